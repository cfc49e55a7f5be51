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

package dev.nishisan.fifo.queue;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Result of a timed pull: either the dequeued item or a timeout marker. A timeout never consumed anything.
 *
 * @param <T> item type
 */
public final class PullResult<T> {

    /**
     * Discriminates the two outcomes.
     */
    public enum Status {
        SUCCESS,
        TIMEOUT
    }

    private static final PullResult<?> TIMEOUT = new PullResult<>(Status.TIMEOUT, null);

    private final Status status;
    private final T item;

    private PullResult(Status status, T item) {
        this.status = status;
        this.item = item;
    }

    static <T> PullResult<T> success(T item) {
        return new PullResult<>(Status.SUCCESS, item);
    }

    @SuppressWarnings("unchecked")
    static <T> PullResult<T> timeout() {
        return (PullResult<T>) TIMEOUT;
    }

    public Status status() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isTimeout() {
        return status == Status.TIMEOUT;
    }

    /**
     * @return the pulled item
     * @throws NoSuchElementException if the pull timed out
     */
    public T item() {
        if (status == Status.TIMEOUT) {
            throw new NoSuchElementException("pull timed out");
        }
        return item;
    }

    public Optional<T> toOptional() {
        return status == Status.SUCCESS ? Optional.of(item) : Optional.empty();
    }

    @Override
    public String toString() {
        return status == Status.SUCCESS ? "PullResult{SUCCESS, " + item + "}" : "PullResult{TIMEOUT}";
    }
}
