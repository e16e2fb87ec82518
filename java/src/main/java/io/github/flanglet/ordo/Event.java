/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.ordo;

/**
 * This class represents events that occur while sorting or selecting. Each
 * event includes attributes such as type, operation id, size, strategy and
 * timestamp.
 */
public class Event {

    /**
     * Enum representing the types of events that can occur.
     */
    public enum Type {
        /**
         * Beginning of a sort
         */
        SORT_START,

        /**
         * End of a sort
         */
        SORT_END,

        /**
         * Beginning of a rank partition
         */
        SELECT_START,

        /**
         * End of a rank partition
         */
        SELECT_END
    }

    /**
     * Enum representing the algorithm chosen by the dispatcher.
     */
    public enum Strategy {
        /**
         * Nothing to do (0 or 1 element)
         */
        NONE,

        /**
         * Fixed compare-exchange network
         */
        NETWORK,

        /**
         * Insertion sort
         */
        INSERTION,

        /**
         * Iterative quicksort
         */
        QUICK,

        /**
         * Bottom-up stable merge sort
         */
        MERGE,

        /**
         * Quickselect
         */
        SELECT
    }

    private final int id;
    private final long size;
    private final Type type;
    private final Strategy strategy;
    private final long time;

    /**
     * Constructs an Event with the specified type, id, size and strategy.
     *
     * @param type
     *            the type of event
     * @param id
     *            the operation id
     * @param size
     *            the number of elements processed
     * @param strategy
     *            the algorithm used
     */
    public Event(Type type, int id, long size, Strategy strategy) {
        this(type, id, size, strategy, 0);
    }

    /**
     * Constructs an Event with the specified type, id, size, strategy and time.
     *
     * @param type
     *            the type of event
     * @param id
     *            the operation id
     * @param size
     *            the number of elements processed
     * @param strategy
     *            the algorithm used
     * @param time
     *            the event timestamp in nanoseconds, or 0 for now
     */
    public Event(Type type, int id, long size, Strategy strategy, long time) {
        this.id = id;
        this.size = size;
        this.type = type;
        this.strategy = strategy;
        this.time = (time > 0) ? time : System.nanoTime();
    }

    /**
     * Returns the operation id.
     *
     * @return the operation id
     */
    public int getId() {
        return this.id;
    }

    /**
     * Returns the number of elements processed.
     *
     * @return the event size
     */
    public long getSize() {
        return this.size;
    }

    /**
     * Returns the timestamp of the event.
     *
     * @return the event timestamp in nanoseconds
     */
    public long getTime() {
        return this.time;
    }

    /**
     * Returns the algorithm used.
     *
     * @return the strategy
     */
    public Strategy getStrategy() {
        return this.strategy;
    }

    /**
     * Returns the type of the event.
     *
     * @return the event type
     */
    public Type getType() {
        return this.type;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(200);
        sb.append("{ \"type\":\"").append(this.getType()).append("\"");
        if (this.id >= 0) {
            sb.append(", \"id\":").append(this.getId());
        }
        sb.append(", \"size\":").append(this.getSize());
        sb.append(", \"strategy\":\"").append(this.getStrategy()).append("\"");
        sb.append(", \"time\":").append(this.getTime());
        sb.append(" }");
        return sb.toString();
    }
}
