/**

Copyright (C) SYSTAP, LLC 2006-2007.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA
*/
/*
 * Created on Mar 5, 2024
 */

package com.datalink.striterator;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;

/**
 * Base class for iterators which read their source in chunks. Each chunk is
 * read in a separate request which resumes after the position of the last
 * element in the previous chunk, so no cursor is held open between chunks.
 * The source must visit elements in ascending position order.
 *
 * @param <E>
 *            The generic type of the visited elements.
 *
 * @author datalink developers
 * @version $Id$
 */
abstract public class AbstractChunkedIterator<E> implements
        ICloseableIterator<E> {

    protected static final transient Logger log = Logger
            .getLogger(AbstractChunkedIterator.class);

    /**
     * The maximum #of elements read per chunk.
     */
    protected final int chunkCapacity;

    private boolean open = true;

    /**
     * <code>true</code> once a chunk shorter than {@link #chunkCapacity} was
     * read, i.e., the source is exhausted.
     */
    private boolean exhausted = false;

    /**
     * The position of the last element read from the source -or-
     * {@link Long#MIN_VALUE} before the first chunk.
     */
    private long lastPosition = Long.MIN_VALUE;

    /** The current chunk. */
    private Iterator<E> chunk = null;

    /** #of chunks read. */
    private int nchunks = 0;

    /**
     * @param chunkCapacity
     *            The maximum #of elements read per chunk.
     */
    protected AbstractChunkedIterator(final int chunkCapacity) {

        if (chunkCapacity <= 0)
            throw new IllegalArgumentException();

        this.chunkCapacity = chunkCapacity;

    }

    /**
     * Read the next chunk from the source.
     *
     * @param fromPosition
     *            The elements visited must have a position strictly greater
     *            than this value.
     * @param capacity
     *            The maximum #of elements to return.
     *
     * @return The elements in ascending position order (never
     *         <code>null</code>).
     */
    abstract protected List<E> readChunk(long fromPosition, int capacity);

    /**
     * The position of an element as returned by {@link #readChunk(long, int)}.
     */
    abstract protected long getPosition(E e);

    public boolean hasNext() {

        if (!open)
            return false;

        while (chunk == null || !chunk.hasNext()) {

            if (exhausted) {

                close();

                return false;

            }

            final List<E> a = readChunk(lastPosition, chunkCapacity);

            nchunks++;

            if (a.size() < chunkCapacity)
                exhausted = true;

            if (!a.isEmpty())
                lastPosition = getPosition(a.get(a.size() - 1));

            chunk = a.iterator();

        }

        return true;

    }

    public E next() {

        if (!hasNext())
            throw new NoSuchElementException();

        return chunk.next();

    }

    /**
     * @throws UnsupportedOperationException
     */
    public void remove() {

        throw new UnsupportedOperationException();

    }

    public void close() {

        if (!open)
            return;

        open = false;

        chunk = null;

        if (log.isDebugEnabled())
            log.debug("Closed after " + nchunks + " chunks");

    }

}
