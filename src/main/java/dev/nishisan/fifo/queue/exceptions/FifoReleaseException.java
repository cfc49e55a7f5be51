/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura@gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.fifo.queue.exceptions;

/**
 * Raised by {@link dev.nishisan.fifo.queue.BoundedFifo#clear()} when one or more discarded items failed to
 * release. The queue is already empty when this is thrown; the first failure is the cause and the rest
 * are attached as suppressed exceptions.
 */
public class FifoReleaseException extends RuntimeException {

    private final int failedCount;

    public FifoReleaseException(String message, Throwable cause, int failedCount) {
        super(message, cause);
        this.failedCount = failedCount;
    }

    /**
     * @return number of items whose release threw
     */
    public int getFailedCount() {
        return failedCount;
    }
}
