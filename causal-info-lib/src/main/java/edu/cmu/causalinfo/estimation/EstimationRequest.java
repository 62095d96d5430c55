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

import edu.cmu.causalinfo.graph.LaggedNode;
import edu.cmu.causalinfo.search.ConditionSet;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * What an estimator needs to compute one information quantity: the raw data, the column of each node, the ordered
 * variable groups x | y | z and the nodes to condition on. The columns are laid out in that order and described by
 * an {@link XyIndex}. The data matrix is passed through as is.
 *
 * @author Joseph Ramsey
 */
public final class EstimationRequest {
    private final RealMatrix data;
    private final Map<LaggedNode, Integer> columns;
    private final List<List<LaggedNode>> groups;
    private final List<LaggedNode> conditions;
    private final XyIndex xyIndex;

    //=============================CONSTRUCTORS==========================//

    /**
     * @param data       the samples, one column per lagged node.
     * @param columns    the column of each node in the data.
     * @param groups     one to three non-empty, disjoint variable groups.
     * @param conditions the nodes to condition on; may be empty.
     */
    public EstimationRequest(RealMatrix data, Map<LaggedNode, Integer> columns, List<List<LaggedNode>> groups,
                             Collection<LaggedNode> conditions) {
        Validate.notNull(data, "Data is null.");
        Validate.notNull(columns, "Column map is null.");
        Validate.notNull(groups, "Groups are null.");
        Validate.notNull(conditions, "Conditions are null.");

        if (groups.isEmpty() || groups.size() > 3) {
            throw new IllegalArgumentException("Need one to three variable groups: " + groups.size());
        }

        List<LaggedNode> seen = new ArrayList<>();
        List<List<LaggedNode>> _groups = new ArrayList<>();

        for (List<LaggedNode> group : groups) {
            if (group == null || group.isEmpty()) {
                throw new IllegalArgumentException("Variable groups may not be empty.");
            }

            checkColumns(group, columns, data, seen);
            _groups.add(Collections.unmodifiableList(new ArrayList<>(group)));
        }

        List<LaggedNode> _conditions = new ArrayList<>(conditions);
        checkColumns(_conditions, columns, data, seen);

        this.data = data;
        this.columns = Collections.unmodifiableMap(new HashMap<>(columns));
        this.groups = Collections.unmodifiableList(_groups);
        this.conditions = Collections.unmodifiableList(_conditions);
        this.xyIndex = new XyIndex(groups.size(), !conditions.isEmpty(), seen.size(), lastIndices(_groups,
                !conditions.isEmpty()));
    }

    public EstimationRequest(RealMatrix data, Map<LaggedNode, Integer> columns, List<List<LaggedNode>> groups,
                             ConditionSet conditions) {
        this(data, columns, groups, conditions.getNodes());
    }

    //==============================PUBLIC METHODS========================//

    public RealMatrix getData() {
        return data;
    }

    public Map<LaggedNode, Integer> getColumns() {
        return columns;
    }

    public List<List<LaggedNode>> getGroups() {
        return groups;
    }

    public List<LaggedNode> getConditions() {
        return conditions;
    }

    public XyIndex getXyIndex() {
        return xyIndex;
    }

    /**
     * @return the data columns in layout order: the groups, then the conditions.
     */
    public int[] getColumnOrder() {
        int[] order = new int[xyIndex.getNumColumns()];
        int k = 0;

        for (List<LaggedNode> group : groups) {
            for (LaggedNode node : group) {
                order[k++] = columns.get(node);
            }
        }

        for (LaggedNode node : conditions) {
            order[k++] = columns.get(node);
        }

        return order;
    }

    @Override
    public String toString() {
        return "groups " + groups + " | conditions " + conditions + " (" + xyIndex + ")";
    }

    //==============================PRIVATE METHODS========================//

    private static void checkColumns(List<LaggedNode> nodes, Map<LaggedNode, Integer> columns, RealMatrix data,
                                     List<LaggedNode> seen) {
        for (LaggedNode node : nodes) {
            Integer column = columns.get(node);

            if (column == null) {
                throw new IllegalArgumentException("No data column for the node " + node);
            }

            if (column < 0 || column >= data.getColumnDimension()) {
                throw new IllegalArgumentException("Column " + column + " for the node " + node
                        + " is outside the data, which has " + data.getColumnDimension() + " columns.");
            }

            if (seen.contains(node)) {
                throw new IllegalArgumentException("The node " + node + " appears more than once.");
            }

            seen.add(node);
        }
    }

    private static int[] lastIndices(List<List<LaggedNode>> groups, boolean conditioned) {
        int n = conditioned ? groups.size() : groups.size() - 1;
        int[] indices = new int[n];
        int end = 0;

        for (int i = 0; i < n; i++) {
            end += groups.get(i).size();
            indices[i] = end;
        }

        return indices;
    }
}
