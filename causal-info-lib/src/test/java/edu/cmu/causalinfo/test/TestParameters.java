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

package edu.cmu.causalinfo.test;

import edu.cmu.causalinfo.util.ParamDefaults;
import edu.cmu.causalinfo.util.Parameters;
import edu.cmu.causalinfo.util.Params;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestParameters {

    @Test
    public void testDefaults() {
        Parameters parameters = new Parameters();

        assertEquals(6, parameters.getInt(Params.TAUMAX));
        assertEquals(1, parameters.getInt(Params.BUNDLE_LEVEL));
        assertFalse(parameters.getBoolean(Params.TRANSITIVE));
        assertFalse(parameters.getBoolean(Params.PARALLEL_REDUCTION));
        assertTrue(parameters.getBoolean(Params.VERBOSE));

        for (String name : Params.getParameterNames()) {
            assertTrue(name, ParamDefaults.getInstance().hasDefault(name));
        }
    }

    @Test
    public void testOverrides() {
        Parameters parameters = new Parameters()
                .set(Params.TAUMAX, "12")
                .set(Params.TRANSITIVE, "true");

        assertEquals(12, parameters.getInt(Params.TAUMAX));
        assertTrue(parameters.getBoolean(Params.TRANSITIVE));
        assertTrue(parameters.isSet(Params.TAUMAX));

        Parameters copy = new Parameters(parameters);
        parameters.remove(Params.TAUMAX);

        assertEquals(6, parameters.getInt(Params.TAUMAX));
        assertEquals(12, copy.getInt(Params.TAUMAX));
    }

    @Test
    public void testFallbackForUnknownName() {
        Parameters parameters = new Parameters();

        assertEquals(3, parameters.getInt("unknown", 3));
        assertTrue(parameters.getBoolean("unknown", true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoDefault() {
        new Parameters().getInt("unknown");
    }

    @Test(expected = NullPointerException.class)
    public void testRejectsNullValue() {
        new Parameters().set(Params.TAUMAX, null);
    }
}
