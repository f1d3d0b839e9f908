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
 * Created on Mar 4, 2024
 */

package com.datalink.config;

import java.util.Properties;

import org.apache.log4j.Logger;

/**
 * Resolves configuration properties against a {@link Properties} object.
 * <p>
 * Defaults are described in the javadoc for the <code>Options</code>
 * interfaces which declare the property names. The caller supplies the
 * default, which is used unless the property is given explicitly.
 * 
 * @author datalink developers
 * @version $Id$
 */
public class Configuration {

    /**
     * Property values are logged at INFO.
     */
    protected static final transient Logger log = Logger.getLogger(Configuration.class);

    /**
     * Return the value for property, which may be the default value.
     * 
     * @param properties
     *            The properties object against which the value of the
     *            property will be resolved.
     * @param name
     *            The name of the property.
     * @param defaultValue
     *            The value for that property that will be returned if it was
     *            not given explicitly (optional).
     * 
     * @return The resolved value for the property.
     */
    public static String getProperty(final Properties properties,
            final String name, final String defaultValue) {

        if (properties == null)
            throw new IllegalArgumentException();

        if (name == null)
            throw new IllegalArgumentException();

        // defaultValue MAY be null.

        String val = properties.getProperty(name);

        if (val == null) {

            // no override.
            val = defaultValue;

        }

        if (log.isInfoEnabled())
            log.info(name + "=" + val);

        return val;

    }

    /**
     * Variant converts to the specified generic type and validates the value.
     * 
     * @return The validated value -or- <code>null</code> if there was no
     *         value and no default.
     * 
     * @throws ConfigurationException
     *             if the value can not be parsed or is rejected by the
     *             validator.
     */
    public static <E> E getProperty(final Properties properties,
            final String name, final String defaultValue,
            final IValidator<E> validator) throws ConfigurationException {

        if (validator == null)
            throw new IllegalArgumentException();

        final String val = getProperty(properties, name, defaultValue);

        if (val == null)
            return null;

        final E e = validator.parse(name, val);

        validator.accept(name, val, e);

        return e;

    }

}
