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

/**
 * Releases an item the queue discards on its own, either by eviction or by {@link BoundedFifo#clear()}.
 * Items handed to a caller through a pull belong to that caller and are never passed here.
 * <p>
 * The releaser reflects the ownership kind of the payload: plain values need nothing, while payloads that
 * hold a resource are closed. The choice is made by the type bound of the factory method, so a releaser
 * that closes items can only be built for {@link AutoCloseable} payloads.
 *
 * @param <T> item type
 */
@FunctionalInterface
public interface ItemReleaser<T> {

    void release(T item) throws Exception;

    /**
     * Releaser for plain values, whose lifetime is handled by the garbage collector.
     */
    static <T> ItemReleaser<T> none() {
        return item -> {
        };
    }

    /**
     * Releaser that calls {@link AutoCloseable#close()} on every discarded item.
     */
    static <T extends AutoCloseable> ItemReleaser<T> closing() {
        return AutoCloseable::close;
    }
}
