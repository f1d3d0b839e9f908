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
package com.datalink.config;

/**
 * Instance thrown if there is a problem with a property value. 
 * 
 * @author datalink developers
 * @version $Id$
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 3016846153213925517L;

    public ConfigurationException(final String key, final String val,
            final String msg) {

        super(msg + ": " + key + "=" + val);

    }

    public ConfigurationException(final String key, final String val,
            final Throwable cause) {

        super("Could not parse: " + key + "=" + val, cause);

    }

}
