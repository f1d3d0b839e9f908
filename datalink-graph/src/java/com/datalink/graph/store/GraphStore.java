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
 * Created on Mar 14, 2024
 */

package com.datalink.graph.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;

import org.apache.log4j.Logger;

import com.datalink.config.Configuration;
import com.datalink.config.IntegerValidator;
import com.datalink.graph.lexicon.ValueIndex;
import com.datalink.graph.model.Edge;
import com.datalink.graph.model.ID;
import com.datalink.graph.model.TypedValue;
import com.datalink.graph.schema.GraphSchema;
import com.datalink.graph.schema.IntegrityCheck;
import com.datalink.graph.spo.KeyOrder;
import com.datalink.graph.spo.LinkIndex;
import com.datalink.journal.ITask;
import com.datalink.journal.Journal;
import com.datalink.migration.IntegrityWarning;
import com.datalink.migration.MigrationFailedException;
import com.datalink.migration.Migrations;
import com.datalink.striterator.ICloseableIterator;

/**
 * A graph of typed values. Value records live in a {@link ValueIndex} and the
 * links between them in a {@link LinkIndex}, both in the same backing store.
 * <p>
 * Opening a store brings it to {@link GraphSchema#CURRENT_VERSION}: a new
 * store is created at that generation and an older store is migrated, one
 * generation at a time. If a migration fails the store is closed, the backing
 * store keeps the generation it had, and the {@link MigrationFailedException}
 * is thrown from the constructor. A store written by a newer version of this
 * class is refused in the same manner.
 *
 * <pre>
 * final Properties properties = new Properties();
 * properties.setProperty(Options.FILE, &quot;graph.db&quot;);
 * final GraphStore store = new GraphStore(properties);
 * try {
 *     final ID a = store.store(TypedValue.str(&quot;a&quot;));
 *     final ID b = store.store(TypedValue.i32(12));
 *     store.addEdge(a, null, b);
 * } finally {
 *     store.close();
 * }
 * </pre>
 *
 * @see Options
 *
 * @author datalink developers
 * @version $Id$
 */
public class GraphStore extends Journal implements IGraphStore {

    protected static final transient Logger log = Logger.getLogger(GraphStore.class);

    private final ValueIndex valueIndex;

    private final LinkIndex linkIndex;

    /**
     * Open or create a store.
     *
     * @param properties
     *            The configuration.
     *
     * @throws MigrationFailedException
     *             if the store could not be brought to the current generation.
     *
     * @see Options
     */
    public GraphStore(final Properties properties) {

        super(properties);

        final int chunkCapacity;

        try {

            chunkCapacity = Configuration.getProperty(properties,
                    Options.CHUNK_CAPACITY, Options.DEFAULT_CHUNK_CAPACITY,
                    IntegerValidator.GT_ZERO);

            final Migrations migrations = new Migrations(this, GraphSchema
                    .getMigrationSteps());

            if (migrations.hasNext() && log.isInfoEnabled())
                log.info("Migrating: " + migrations.getVersion() + " => "
                        + migrations.getTargetVersion() + " : " + this);

            migrations.runAll();

        } catch (RuntimeException ex) {

            log.error("Could not open: " + this + " : " + ex);

            close();

            throw ex;

        }

        valueIndex = new ValueIndex(this);

        linkIndex = new LinkIndex(this, chunkCapacity);

    }

    public ValueIndex getValueIndex() {

        return valueIndex;

    }

    public LinkIndex getLinkIndex() {

        return linkIndex;

    }

    /*
     * Values.
     */

    public void put(final ID id, final TypedValue value) {

        valueIndex.put(id, value);

    }

    public void insert(final ID id, final TypedValue value) {

        if (!valueIndex.insert(id, value))
            throw new DuplicateIdentifierException(id);

    }

    public ID store(final TypedValue value) {

        final ID id = ID.random();

        insert(id, value);

        return id;

    }

    public TypedValue get(final ID id) {

        final TypedValue value = valueIndex.get(id);

        if (value == null)
            throw new NotFoundException(id);

        return value;

    }

    public boolean contains(final ID id) {

        return valueIndex.contains(id);

    }

    public boolean delete(final ID id) {

        return valueIndex.delete(id);

    }

    public List<ID> findByString(final String text) {

        return valueIndex.findByString(text);

    }

    public List<ID> findByStringLike(final String pattern) {

        return valueIndex.findByStringLike(pattern);

    }

    public long getValueCount() {

        return valueIndex.getValueCount();

    }

    /*
     * Links.
     */

    public Edge addEdge(final ID source, final ID key, final ID target) {

        return linkIndex.addEdge(source, key, target);

    }

    public boolean removeEdge(final Edge edge) {

        return linkIndex.removeEdge(edge);

    }

    public ICloseableIterator<Edge> edgesFrom(final ID source) {

        if (source == null)
            throw new IllegalArgumentException();

        return linkIndex.rangeQuery(KeyOrder.SOURCE, source);

    }

    public ICloseableIterator<Edge> edgesFromWithKey(final ID source,
            final ID key) {

        if (source == null)
            throw new IllegalArgumentException();

        return linkIndex.rangeQuery(KeyOrder.SOURCE_KEY, source, key);

    }

    public ICloseableIterator<Edge> edgesByKey(final ID key) {

        return linkIndex.rangeQuery(KeyOrder.KEY, key);

    }

    public ICloseableIterator<Edge> edgesTo(final ID target) {

        if (target == null)
            throw new IllegalArgumentException();

        return linkIndex.rangeQuery(KeyOrder.TARGET, target);

    }

    public long getLinkCount() {

        return linkIndex.getLinkCount();

    }

    /*
     * Integrity.
     */

    public List<IntegrityWarning> checkIntegrity() {

        final List<IntegrityWarning> warnings = execute(new ITask<List<IntegrityWarning>>() {

            public List<IntegrityWarning> call(final Connection conn)
                    throws SQLException {

                return IntegrityCheck.check(conn);

            }

        });

        for (IntegrityWarning w : warnings) {

            log.warn(w);

        }

        return warnings;

    }

}
