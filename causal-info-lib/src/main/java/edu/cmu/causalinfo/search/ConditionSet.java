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

package edu.cmu.causalinfo.search;

import edu.cmu.causalinfo.graph.LaggedNode;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A set of nodes to condition on, sorted and free of duplicates. An empty condition set is a valid answer; the
 * outcome says whether it was derived normally or is empty because a source was not linked to the target.
 * Invalid input never produces a condition set; it throws.
 *
 * @author Joseph Ramsey
 */
public final class ConditionSet implements Iterable<LaggedNode> {

    public enum Outcome {
        DERIVED,
        UNLINKED
    }

    private static final ConditionSet UNLINKED = new ConditionSet(new TreeSet<>(), Outcome.UNLINKED);

    private final SortedSet<LaggedNode> nodes;
    private final Outcome outcome;

    private ConditionSet(SortedSet<LaggedNode> nodes, Outcome outcome) {
        this.nodes = Collections.unmodifiableSortedSet(nodes);
        this.outcome = outcome;
    }

    public static ConditionSet derived(Collection<LaggedNode> nodes) {
        return new ConditionSet(new TreeSet<>(nodes), Outcome.DERIVED);
    }

    public static ConditionSet unlinked() {
        return UNLINKED;
    }

    public SortedSet<LaggedNode> getNodes() {
        return nodes;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(LaggedNode node) {
        return nodes.contains(node);
    }

    @Override
    public Iterator<LaggedNode> iterator() {
        return nodes.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConditionSet)) return false;
        ConditionSet that = (ConditionSet) o;
        return outcome == that.outcome && nodes.equals(that.nodes);
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + outcome.hashCode();
    }

    @Override
    public String toString() {
        return outcome == Outcome.UNLINKED ? "UNLINKED " + nodes : nodes.toString();
    }
}
