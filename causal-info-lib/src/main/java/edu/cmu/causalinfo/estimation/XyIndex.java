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

package edu.cmu.causalinfo.estimation;

import java.util.Arrays;

/**
 * Column boundaries of the variable groups in a data matrix laid out as x | y | z | conditions. Each index is the
 * exclusive end column of a group, counted from 1, so with indices [2, 5] and 7 columns, x is columns 0-1, y columns
 * 2-4 and the last group columns 5-6.
 * <p>
 * Layouts by case:
 * <pre>
 *     case  conditioned   indices     rule
 *      1       no           []
 *      1       yes          [x]        x &lt;= ndim
 *      2       no           [x]        x &lt;= ndim
 *      2       yes          [x, y]     x &lt; y &lt;= ndim
 *      3       no           [x, y]     x &lt; y &lt;= ndim
 *      3       yes          [x, y, z]  x &lt; y &lt; z &lt;= ndim
 * </pre>
 * The group after the last index runs to the end of the matrix. A null index gives the defaults 1 / 1, 2 / 1, 2, 3.
 *
 * @author Joseph Ramsey
 */
public final class XyIndex {
    private final int numGroups;
    private final boolean conditioned;
    private final int numColumns;
    private final int[] lastIndices;

    //=============================CONSTRUCTORS==========================//

    /**
     * @param numGroups   the number of variable groups (x, y, z), 1 to 3.
     * @param conditioned whether conditioning columns follow the groups.
     * @param numColumns  the number of columns of the data matrix.
     * @param indices     the end columns, or null for the defaults.
     * @throws IllegalArgumentException if the indices do not fit the case.
     */
    public XyIndex(int numGroups, boolean conditioned, int numColumns, int[] indices) {
        if (numGroups < 1 || numGroups > 3) {
            throw new IllegalArgumentException("The number of variable groups must be 1, 2 or 3: " + numGroups);
        }

        if (numColumns < numGroups) {
            throw new IllegalArgumentException("The data has " + numColumns + " columns, fewer than the "
                    + numGroups + " variable groups.");
        }

        int expected = conditioned ? numGroups : numGroups - 1;

        if (indices == null) {
            indices = new int[expected];

            for (int i = 0; i < expected; i++) {
                indices[i] = i + 1;
            }
        }

        String name = numGroups + "D" + (conditioned ? " conditioned" : "") + " case";

        if (indices.length != expected) {
            throw new IllegalArgumentException("The index is not correct for the " + name + ": expected "
                    + expected + " entries but got " + Arrays.toString(indices));
        }

        for (int i = 0; i < indices.length; i++) {
            int lower = i == 0 ? 1 : indices[i - 1] + 1;

            if (indices[i] < lower || indices[i] > numColumns) {
                throw new IllegalArgumentException("The index is not correct for the " + name + ": entry " + i
                        + " = " + indices[i] + " in " + Arrays.toString(indices) + " with " + numColumns
                        + " columns");
            }
        }

        this.numGroups = numGroups;
        this.conditioned = conditioned;
        this.numColumns = numColumns;
        this.lastIndices = indices.clone();
    }

    //==============================PUBLIC METHODS========================//

    public int getNumGroups() {
        return numGroups;
    }

    public boolean isConditioned() {
        return conditioned;
    }

    public int getNumColumns() {
        return numColumns;
    }

    public int[] getLastIndices() {
        return lastIndices.clone();
    }

    /**
     * @param group 0 for x, 1 for y, 2 for z.
     * @return {start, end} of the group's columns, end exclusive.
     */
    public int[] getGroupRange(int group) {
        if (group < 0 || group >= numGroups) {
            throw new IllegalArgumentException("No group " + group + " in the " + numGroups + "D case.");
        }

        int start = group == 0 ? 0 : lastIndices[group - 1];
        int end = group < lastIndices.length ? lastIndices[group] : numColumns;
        return new int[]{start, end};
    }

    /**
     * @return {start, end} of the conditioning columns; empty if unconditioned.
     */
    public int[] getConditionRange() {
        if (!conditioned) {
            return new int[]{numColumns, numColumns};
        }

        return new int[]{lastIndices[lastIndices.length - 1], numColumns};
    }

    @Override
    public String toString() {
        return numGroups + "D" + (conditioned ? " conditioned " : " ") + Arrays.toString(lastIndices) + " of "
                + numColumns;
    }
}
