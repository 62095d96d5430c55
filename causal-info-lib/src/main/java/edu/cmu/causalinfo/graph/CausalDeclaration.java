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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The lagged causal structure among a fixed, ordered sequence of variables. For each variable it records the parent
 * nodes relative to lag 0; e.g. variable 1 with parents (0, 0) and (1, -1) depends on variable 0 at the same time and
 * on itself one step back. The structure is assumed stationary, so the graph builder replicates it at every layer.
 * <p>
 * The index of a variable is its position in the sequence given at construction. Declarations are usually produced
 * by a causal discovery step; nothing here checks that the structure is acyclic.
 *
 * @author Joseph Ramsey
 */
public final class CausalDeclaration {
    private final List<String> variableNames;
    private final List<Set<LaggedNode>> parents;

    //=============================CONSTRUCTORS==========================//

    public CausalDeclaration(List<String> variableNames) {
        Validate.notNull(variableNames, "Variable names are null.");
        Validate.isTrue(!variableNames.isEmpty(), "Need at least one variable.");
        Validate.noNullElements(variableNames, "Variable name at %d is null.");

        if (new LinkedHashSet<>(variableNames).size() != variableNames.size()) {
            throw new IllegalArgumentException("Duplicate variable names: " + variableNames);
        }

        this.variableNames = Collections.unmodifiableList(new ArrayList<>(variableNames));
        this.parents = new ArrayList<>();

        for (int i = 0; i < variableNames.size(); i++) {
            this.parents.add(new LinkedHashSet<>());
        }
    }

    /**
     * A declaration over variables named X0, X1, ...
     */
    public CausalDeclaration(int numVariables) {
        this(defaultNames(numVariables));
    }

    /**
     * Builds a declaration from a map of variable index to parents, e.g. {0: [(0, -1), (1, -1)], 1: [(0, 0), (1, -1)]}.
     * The keys must be exactly 0 .. n - 1.
     */
    public static CausalDeclaration fromMap(Map<Integer, List<LaggedNode>> parentMap) {
        Validate.notNull(parentMap, "Parent map is null.");
        int numVariables = parentMap.size();

        for (int i = 0; i < numVariables; i++) {
            if (!parentMap.containsKey(i)) {
                throw new IllegalArgumentException("Variables must be indexed 0.." + (numVariables - 1)
                        + "; missing " + i + " in " + parentMap.keySet());
            }
        }

        CausalDeclaration declaration = new CausalDeclaration(numVariables);

        for (int i = 0; i < numVariables; i++) {
            for (LaggedNode parent : parentMap.get(i)) {
                declaration.addParent(i, parent);
            }
        }

        return declaration;
    }

    //==============================PUBLIC METHODS========================//

    /**
     * Declares that the given parent node (relative to lag 0) causes the child variable at lag 0.
     *
     * @return this declaration.
     */
    public CausalDeclaration addParent(int child, LaggedNode parent) {
        Validate.notNull(parent, "Parent is null.");
        checkVariable(child);
        checkVariable(parent.getVariable());

        if (parent.getLag() > 0) {
            throw new IllegalArgumentException("Parent " + parent + " of variable " + child
                    + " has a positive lag; parents must lie in the past or present.");
        }

        parents.get(child).add(parent);
        return this;
    }

    public CausalDeclaration addParent(int child, int parentVariable, int lag) {
        return addParent(child, new LaggedNode(parentVariable, lag));
    }

    public int getNumVariables() {
        return variableNames.size();
    }

    public List<String> getVariableNames() {
        return variableNames;
    }

    public String getVariableName(int variable) {
        checkVariable(variable);
        return variableNames.get(variable);
    }

    public int getVariableIndex(String name) {
        int index = variableNames.indexOf(name);

        if (index == -1) {
            throw new IllegalArgumentException("Unknown variable: " + name);
        }

        return index;
    }

    /**
     * @return the declared parents of the variable in the order they were added.
     */
    public List<LaggedNode> getParents(int variable) {
        checkVariable(variable);
        return Collections.unmodifiableList(new ArrayList<>(parents.get(variable)));
    }

    /**
     * @return the largest |lag| of any declared parent.
     */
    public int getMaxLag() {
        int max = 0;

        for (Set<LaggedNode> p : parents) {
            for (LaggedNode node : p) {
                max = Math.max(max, -node.getLag());
            }
        }

        return max;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();

        for (int i = 0; i < variableNames.size(); i++) {
            b.append(variableNames.get(i)).append(" <-- ").append(parents.get(i)).append("\n");
        }

        return b.toString();
    }

    //==============================PRIVATE METHODS========================//

    private void checkVariable(int variable) {
        if (variable < 0 || variable >= variableNames.size()) {
            throw new InvalidNodeException("The variable " + variable + " is not in the declared variable set "
                    + variableNames + ".");
        }
    }

    private static List<String> defaultNames(int numVariables) {
        Validate.isTrue(numVariables > 0, "Need at least one variable: %d", numVariables);
        List<String> names = new ArrayList<>();

        for (int i = 0; i < numVariables; i++) {
            names.add("X" + i);
        }

        return names;
    }
}
