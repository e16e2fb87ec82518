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

package io.github.flanglet.ordo.app;

import io.github.flanglet.ordo.Event;
import io.github.flanglet.ordo.Listener;
import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The {@code InfoPrinter} class implements the {@code Listener} interface and
 * prints information about the sort and select operations of a dispatcher.
 *
 * <p>At level 3 and above, one line is printed per completed operation with its
 * size, strategy and duration. At level 5, every raw event is printed too.</p>
 */
public class InfoPrinter implements Listener {

    private final PrintStream ps;
    private final Map<Integer, Long> startTimes;
    private final int level;

    /**
     * Constructs an {@code InfoPrinter} with the specified information level
     * and output stream.
     *
     * @param infoLevel
     *            the level of information to be printed
     * @param ps
     *            the {@code PrintStream} to which information will be printed
     */
    public InfoPrinter(int infoLevel, PrintStream ps) {
        if (ps == null)
            throw new NullPointerException("Invalid null print stream parameter");

        this.ps = ps;
        this.level = infoLevel;
        this.startTimes = new ConcurrentHashMap<>();
    }

    @Override
    public void processEvent(Event evt) {
        final int id = evt.getId();

        if ((evt.getType() == Event.Type.SORT_START) || (evt.getType() == Event.Type.SELECT_START)) {
            this.startTimes.put(id, evt.getTime());

            if (this.level >= 5)
                this.ps.println(evt);

            return;
        }

        final Long time0 = this.startTimes.remove(id);

        if (this.level >= 5)
            this.ps.println(evt);

        if ((time0 == null) || (this.level < 3))
            return;

        final long durationMs = (evt.getTime() - time0) / 1000000L;
        final String op = (evt.getType() == Event.Type.SELECT_END) ? "Select" : "Sort";
        this.ps.println(String.format("%s %d: %d elements, %s [%d ms]", op, id, evt.getSize(),
            evt.getStrategy(), durationMs));
    }
}
