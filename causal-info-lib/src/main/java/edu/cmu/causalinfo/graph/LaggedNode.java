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

package edu.cmu.causalinfo.graph;

import java.util.Objects;

/**
 * A variable at a time lag in the unrolled graph. Lag 0 is the present; earlier times have negative lags.
 * <p>
 * Nodes are ordered by (|lag|, variable), which is the order of their flat ids under {@link NodeCodec}. Ties
 * between a lag and its negation, which only arise for invalid future lags, are broken on the signed lag.
 *
 * @author Joseph Ramsey
 */
public final class LaggedNode implements Comparable<LaggedNode> {
    private final int variable;
    private final int lag;

    //=============================CONSTRUCTORS==========================//

    public LaggedNode(int variable, int lag) {
        this.variable = variable;
        this.lag = lag;
    }

    public static LaggedNode of(int variable, int lag) {
        return new LaggedNode(variable, lag);
    }

    //==============================PUBLIC METHODS========================//

    public int getVariable() {
        return variable;
    }

    public int getLag() {
        return lag;
    }

    /**
     * @return the same variable shifted by the given number of steps back in time.
     */
    public LaggedNode shiftBack(int steps) {
        return new LaggedNode(variable, lag - steps);
    }

    @Override
    public int compareTo(LaggedNode other) {
        int c = Integer.compare(Math.abs(lag), Math.abs(other.lag));
        if (c != 0) return c;
        c = Integer.compare(variable, other.variable);
        if (c != 0) return c;
        return Integer.compare(lag, other.lag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LaggedNode)) return false;
        LaggedNode that = (LaggedNode) o;
        return variable == that.variable && lag == that.lag;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, lag);
    }

    @Override
    public String toString() {
        return "(" + variable + ", " + lag + ")";
    }
}
