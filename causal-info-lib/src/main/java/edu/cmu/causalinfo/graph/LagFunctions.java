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

import org.apache.commons.lang3.Validate;

/**
 * Coupling strengths indexed by (parent variable, child variable, |lag|). These become the weights of the edges of
 * the unrolled graph.
 *
 * @author Joseph Ramsey
 */
public final class LagFunctions {
    private final double[][][] values;
    private final int numVariables;
    private final int taumax;

    //=============================CONSTRUCTORS==========================//

    /**
     * @param values an array of shape numVariables x numVariables x (taumax + 1). It is copied.
     */
    public LagFunctions(double[][][] values) {
        Validate.notNull(values, "Lag functions are null.");
        Validate.isTrue(values.length > 0, "Lag functions are empty.");

        this.numVariables = values.length;
        this.taumax = values[0].length > 0 ? values[0][0].length - 1 : -1;

        if (taumax < 0) {
            throw new IllegalArgumentException("Lag functions need at least one lag.");
        }

        this.values = new double[numVariables][numVariables][taumax + 1];

        for (int i = 0; i < numVariables; i++) {
            if (values[i].length != numVariables) {
                throw new IllegalArgumentException("Lag functions are not square in the variables: row " + i
                        + " has " + values[i].length + " entries, expecting " + numVariables + ".");
            }

            for (int j = 0; j < numVariables; j++) {
                if (values[i][j].length != taumax + 1) {
                    throw new IllegalArgumentException("Lag functions at (" + i + ", " + j + ") have "
                            + values[i][j].length + " lags, expecting " + (taumax + 1) + ".");
                }

                System.arraycopy(values[i][j], 0, this.values[i][j], 0, taumax + 1);
            }
        }
    }

    /**
     * Every coupling equal to 1.0. Used when no lag functions are supplied.
     */
    public static LagFunctions uniform(int numVariables, int taumax) {
        Validate.isTrue(numVariables > 0, "Need at least one variable: %d", numVariables);
        Validate.isTrue(taumax >= 0, "taumax must be non-negative: %d", taumax);

        double[][][] values = new double[numVariables][numVariables][taumax + 1];

        for (int i = 0; i < numVariables; i++) {
            for (int j = 0; j < numVariables; j++) {
                for (int k = 0; k <= taumax; k++) {
                    values[i][j][k] = 1.0;
                }
            }
        }

        return new LagFunctions(values);
    }

    //==============================PUBLIC METHODS========================//

    public double get(int parent, int child, int lag) {
        return values[parent][child][Math.abs(lag)];
    }

    public int getNumVariables() {
        return numVariables;
    }

    public int getTaumax() {
        return taumax;
    }

    public double min() {
        double min = Double.POSITIVE_INFINITY;

        for (double[][] a : values) {
            for (double[] b : a) {
                for (double c : b) {
                    if (c < min) min = c;
                }
            }
        }

        return min;
    }
}
