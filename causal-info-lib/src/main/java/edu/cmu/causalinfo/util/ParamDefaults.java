///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 1998, 1999, 2000, 2001, 2002, 2003, 2004, 2005, 2006,       //
// 2007, 2008, 2009, 2010, 2014, 2015 by Peter Spirtes, Richard Scheines, Joseph   //
// Ramsey, and Clark Glymour.                                                //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package edu.cmu.causalinfo.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Default parameter values, read once from the classpath resource /causalinfo/parameters.properties.
 *
 * @author Joseph Ramsey
 */
public final class ParamDefaults {
    private static final String RESOURCE = "/causalinfo/parameters.properties";
    private static final ParamDefaults INSTANCE = new ParamDefaults();

    private final Properties defaults = new Properties();

    private ParamDefaults() {
        try (InputStream in = ParamDefaults.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing parameter defaults: " + RESOURCE);
            }

            defaults.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read parameter defaults from " + RESOURCE, e);
        }
    }

    public static ParamDefaults getInstance() {
        return INSTANCE;
    }

    public boolean hasDefault(String name) {
        return defaults.containsKey(name);
    }

    /**
     * @return the default value as text.
     * @throws IllegalArgumentException if the parameter has no default.
     */
    public String get(String name) {
        String value = defaults.getProperty(name);

        if (value == null) {
            throw new IllegalArgumentException("No default for parameter: " + name);
        }

        return value.trim();
    }
}
