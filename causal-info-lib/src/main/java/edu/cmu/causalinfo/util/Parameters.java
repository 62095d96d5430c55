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

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named parameter values. Anything not set explicitly falls back to {@link ParamDefaults}.
 *
 * @author Joseph Ramsey
 */
public class Parameters implements Serializable {
    static final long serialVersionUID = 23L;

    private final Map<String, Object> parameters = new LinkedHashMap<>();

    public Parameters() {
    }

    public Parameters(Parameters parameters) {
        this.parameters.putAll(parameters.parameters);
    }

    public int getInt(String name) {
        Object value = parameters.get(name);

        if (value == null) {
            return Integer.parseInt(ParamDefaults.getInstance().get(name));
        }

        if (value instanceof Number) {
            return ((Number) value).intValue();
        }

        return Integer.parseInt(value.toString().trim());
    }

    public int getInt(String name, int defaultValue) {
        if (!parameters.containsKey(name) && !ParamDefaults.getInstance().hasDefault(name)) {
            return defaultValue;
        }

        return getInt(name);
    }

    public double getDouble(String name) {
        Object value = parameters.get(name);

        if (value == null) {
            return Double.parseDouble(ParamDefaults.getInstance().get(name));
        }

        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }

        return Double.parseDouble(value.toString().trim());
    }

    public boolean getBoolean(String name) {
        Object value = parameters.get(name);

        if (value == null) {
            return Boolean.parseBoolean(ParamDefaults.getInstance().get(name));
        }

        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        return Boolean.parseBoolean(value.toString().trim());
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        if (!parameters.containsKey(name) && !ParamDefaults.getInstance().hasDefault(name)) {
            return defaultValue;
        }

        return getBoolean(name);
    }

    public Parameters set(String name, Object value) {
        if (value == null) {
            throw new NullPointerException("Value for " + name + " is null.");
        }

        parameters.put(name, value);
        return this;
    }

    public boolean isSet(String name) {
        return parameters.containsKey(name);
    }

    public void remove(String name) {
        parameters.remove(name);
    }

    @Override
    public String toString() {
        return parameters.toString();
    }
}
