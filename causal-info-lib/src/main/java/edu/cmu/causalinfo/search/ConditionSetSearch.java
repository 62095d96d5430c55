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

import edu.cmu.causalinfo.graph.CausalDeclaration;
import edu.cmu.causalinfo.graph.Edge;
import edu.cmu.causalinfo.graph.GraphPaths;
import edu.cmu.causalinfo.graph.LagFunctions;
import edu.cmu.causalinfo.graph.LaggedNode;
import edu.cmu.causalinfo.graph.LinkClassifier;
import edu.cmu.causalinfo.graph.LinkType;
import edu.cmu.causalinfo.graph.NodeCodec;
import edu.cmu.causalinfo.graph.PathAndParents;
import edu.cmu.causalinfo.graph.TimeLagGraph;
import edu.cmu.causalinfo.graph.TimeLagGraphBuilder;
import edu.cmu.causalinfo.util.DiagnosticEvent;
import edu.cmu.causalinfo.util.DiagnosticSink;
import edu.cmu.causalinfo.util.LoggingDiagnosticSink;
import edu.cmu.causalinfo.util.Parameters;
import edu.cmu.causalinfo.util.Params;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Finds the nodes to condition on when estimating information measures between sources and a target in a
 * time-lagged causal graph:
 * <ul>
 * <li>MIT, the momentary information transfer between two nodes;</li>
 * <li>MITP, the momentary information transfer along causal paths;</li>
 * <li>MPID, the momentary partial information decomposition of two sources and a target, also for two sets of
 * sources;</li>
 * <li>the components of the cumulative information transfer from several sources, and from a bundle of source
 * variables split into immediate and distant history.</li>
 * </ul>
 * Condition sets can optionally be pruned by weighted transitive reduction.
 * <p>
 * References: Runge, PRE (2015); Jiang and Kumar, PRE (2018).
 * <p>
 * Every public method checks its nodes before touching the graph and throws InvalidNodeException for a bad one. A
 * source that is not linked to the target is not an error: it yields an empty or reduced result and a diagnostic
 * event. The graph is never modified, so one search may be used from several threads.
 *
 * @author Joseph Ramsey
 */
public final class ConditionSetSearch {
    private final TimeLagGraph graph;
    private final NodeCodec codec;
    private final GraphPaths paths;
    private final LinkClassifier classifier;
    private final WeightedTransitiveReduction reduction;
    private final DiagnosticSink sink;

    /**
     * Whether condition sets are pruned when a call does not say.
     */
    private boolean transitive = false;

    /**
     * Approximation level for bundled components when a call does not say.
     */
    private int bundleLevel = 1;

    private boolean verbose = true;

    //=============================CONSTRUCTORS==========================//

    public ConditionSetSearch(TimeLagGraph graph) {
        this(graph, new LoggingDiagnosticSink());
    }

    public ConditionSetSearch(TimeLagGraph graph, DiagnosticSink sink) {
        this(graph, sink, new WeightedTransitiveReduction(graph));
    }

    public ConditionSetSearch(TimeLagGraph graph, DiagnosticSink sink, WeightedTransitiveReduction reduction) {
        Validate.notNull(graph, "Graph is null.");
        Validate.notNull(sink, "Diagnostic sink is null.");
        Validate.notNull(reduction, "Transitive reduction is null.");
        this.graph = graph;
        this.codec = graph.getCodec();
        this.sink = sink;
        this.paths = new GraphPaths(graph, sink);
        this.classifier = new LinkClassifier(paths, sink);
        this.reduction = reduction;
    }

    /**
     * Builds the graph and the search from parameters: taumax, transitive, bundleLevel, parallelReduction and
     * verbose.
     *
     * @param lagFunctions the coupling strengths, or null for uniform weights.
     */
    public static ConditionSetSearch fromParameters(CausalDeclaration declaration, LagFunctions lagFunctions,
                                                    Parameters parameters) {
        return fromParameters(declaration, lagFunctions, parameters, new LoggingDiagnosticSink());
    }

    public static ConditionSetSearch fromParameters(CausalDeclaration declaration, LagFunctions lagFunctions,
                                                    Parameters parameters, DiagnosticSink sink) {
        Validate.notNull(parameters, "Parameters are null.");
        TimeLagGraph graph = TimeLagGraphBuilder.build(declaration, lagFunctions, parameters.getInt(Params.TAUMAX));

        ConditionSetSearch search = new ConditionSetSearch(graph, sink,
                new WeightedTransitiveReduction(graph, parameters.getBoolean(Params.PARALLEL_REDUCTION)));
        search.setTransitive(parameters.getBoolean(Params.TRANSITIVE));
        search.setBundleLevel(parameters.getInt(Params.BUNDLE_LEVEL));
        search.setVerbose(parameters.getBoolean(Params.VERBOSE));
        return search;
    }

    //==============================PUBLIC METHODS========================//

    public TimeLagGraph getGraph() {
        return graph;
    }

    public GraphPaths getPaths() {
        return paths;
    }

    public WeightedTransitiveReduction getReduction() {
        return reduction;
    }

    public SortedSet<LaggedNode> searchParents(LaggedNode node) {
        codec.checkNode(node);
        return verbose ? paths.searchParents(node) : paths.parentsOf(Collections.singletonList(node));
    }

    public SortedSet<LaggedNode> searchChildren(LaggedNode node) {
        codec.checkNode(node);
        return verbose ? paths.searchChildren(node) : paths.childrenOf(Collections.singletonList(node));
    }

    /**
     * @return every causal path from source to target.
     */
    public List<List<LaggedNode>> searchCausalPaths(LaggedNode source, LaggedNode target) {
        checkNodes(source, target);
        return paths.simplePaths(source, target);
    }

    /**
     * @return the nodes on the causal paths from source to target, target excluded.
     */
    public SortedSet<LaggedNode> searchCausalPathNodes(LaggedNode source, LaggedNode target) {
        checkNodes(source, target);
        return paths.causalPathNodes(source, target);
    }

    public LinkType checkLinks(LaggedNode source, LaggedNode target) {
        checkNodes(source, target);
        return classifier.checkLinks(source, target, verbose);
    }

    /**
     * MIT conditions: the parents of the source together with the parents of the target other than the source.
     * There is no path requirement.
     */
    public ConditionSet searchMitCondition(LaggedNode source, LaggedNode target) {
        checkNodes(source, target);

        SortedSet<LaggedNode> w = paths.parentsOf(Collections.singletonList(source));
        SortedSet<LaggedNode> targetParents = paths.parentsOf(Collections.singletonList(target));
        targetParents.remove(source);
        w.addAll(targetParents);

        ConditionSet conditions = ConditionSet.derived(w);
        reportConditions(source + " to " + target, conditions);
        return conditions;
    }

    public ConditionSet searchMitpCondition(LaggedNode source, LaggedNode target) {
        return searchMitpCondition(source, target, transitive);
    }

    /**
     * MITP conditions: the parents of the causal path nodes from source to target, plus the parents of the target
     * that are off those paths. Empty and UNLINKED if there is no causal path; empty if the only path is the direct
     * edge.
     */
    public ConditionSet searchMitpCondition(LaggedNode source, LaggedNode target, boolean transitive) {
        checkNodes(source, target);

        LinkType linkType = classifier.checkLinks(source, target, false);

        if (linkType == LinkType.NONE) {
            report(DiagnosticEvent.Type.NOT_LINKED, "The two nodes " + source + " and " + target
                    + " are not connected by a causal path.", source, target);
            return ConditionSet.unlinked();
        }

        if (linkType == LinkType.DIRECTED && !paths.hasMultiHopPath(source, target)) {
            ConditionSet conditions = ConditionSet.derived(Collections.emptySet());
            reportConditions(source + " to " + target + " (direct link only)", conditions);
            return conditions;
        }

        PathAndParents pp = paths.pathAndParents(source, target);
        SortedSet<LaggedNode> w = new TreeSet<>(pp.getParents());
        w.addAll(minus(paths.parentsOf(Collections.singletonList(target)), pp.getPathNodes()));

        if (transitive) {
            w = reduce(w, pp.getPathNodes()).getKept();
        }

        ConditionSet conditions = ConditionSet.derived(w);
        reportConditions(source + " to " + target + " (" + linkType + ")", conditions);
        return conditions;
    }

    public MpidCondition searchMpidCondition(LaggedNode source1, LaggedNode source2, LaggedNode target) {
        return searchMpidCondition(source1, source2, target, transitive);
    }

    /**
     * MPID conditions for two sources and a target. Both sources must be linked to the target; otherwise the result
     * is empty and UNLINKED.
     */
    public MpidCondition searchMpidCondition(LaggedNode source1, LaggedNode source2, LaggedNode target,
                                             boolean transitive) {
        checkNodes(source1, source2, target);

        for (LaggedNode source : new LaggedNode[]{source1, source2}) {
            if (!classifier.checkLinks(source, target, false).isLinked()) {
                report(DiagnosticEvent.Type.NOT_LINKED, "The source " + source + " and the target " + target
                        + " are not linked by a causal path.", source, target);
                return MpidCondition.unlinked();
            }
        }

        SortedSet<LaggedNode> targetParents = paths.parentsOf(Collections.singletonList(target));
        PathAndParents pp1 = paths.pathAndParents(source1, target);
        PathAndParents pp2 = paths.pathAndParents(source2, target);

        SortedSet<LaggedNode> pathNodes = union(pp1.getPathNodes(), pp2.getPathNodes());
        SortedSet<LaggedNode> w1 = minus(targetParents, pathNodes);
        SortedSet<LaggedNode> w2 = minus(pp1.getParents(), pp2.getPathNodes());
        SortedSet<LaggedNode> w3 = minus(pp2.getParents(), pp1.getPathNodes());

        SortedSet<LaggedNode> w = union(w1, w2);
        w.addAll(w3);

        if (transitive) {
            w = reduce(w, pathNodes).getKept();
        }

        ConditionSet conditions = ConditionSet.derived(w);
        reportConditions(source1 + " and " + source2 + " to " + target, conditions);
        return new MpidCondition(conditions, w1, w2, w3, pathNodes);
    }

    public MpidSetCondition searchMpidSetCondition(List<LaggedNode> sources1, List<LaggedNode> sources2,
                                                   LaggedNode target) {
        return searchMpidSetCondition(sources1, sources2, target, transitive);
    }

    /**
     * MPID conditions for two sets of sources. Sources not linked to the target are dropped from their set, with a
     * SOURCE_DROPPED event. The path nodes of a set are the union over its retained sources; its path parents are the
     * parents of that union.
     */
    public MpidSetCondition searchMpidSetCondition(List<LaggedNode> sources1, List<LaggedNode> sources2,
                                                   LaggedNode target, boolean transitive) {
        Validate.notNull(sources1, "First source set is null.");
        Validate.notNull(sources2, "Second source set is null.");
        codec.checkNodes(sources1);
        codec.checkNodes(sources2);
        codec.checkNode(target);

        List<LaggedNode> retained1 = linkedSources(sources1, target);
        List<LaggedNode> retained2 = linkedSources(sources2, target);

        SortedSet<LaggedNode> targetParents = paths.parentsOf(Collections.singletonList(target));
        PathAndParents pp1 = pathAndParents(retained1, target);
        PathAndParents pp2 = pathAndParents(retained2, target);

        SortedSet<LaggedNode> pathNodes = union(pp1.getPathNodes(), pp2.getPathNodes());
        SortedSet<LaggedNode> w = minus(targetParents, pathNodes);
        w.addAll(minus(pp1.getParents(), pp2.getPathNodes()));
        w.addAll(minus(pp2.getParents(), pp1.getPathNodes()));

        if (transitive) {
            w = reduce(w, pathNodes).getKept();
        }

        ConditionSet conditions = ConditionSet.derived(w);
        reportConditions("two sets of source nodes to " + target, conditions);
        return new MpidSetCondition(retained1, retained2, conditions, pathNodes);
    }

    public CitComponents searchCitComponents(List<LaggedNode> sources, LaggedNode target) {
        return searchCitComponents(sources, target, transitive);
    }

    /**
     * Components of the cumulative information transfer from several sources to a target: the conditions (parents
     * of the target and of the path nodes, both off the paths), the target's parents on the paths and the path
     * nodes. Unlinked sources are dropped; if none is left the result is empty and UNLINKED.
     */
    public CitComponents searchCitComponents(List<LaggedNode> sources, LaggedNode target, boolean transitive) {
        Validate.notNull(sources, "Sources are null.");
        codec.checkNodes(sources);
        codec.checkNode(target);

        List<LaggedNode> retained = linkedSources(sources, target);

        if (retained.isEmpty()) {
            return CitComponents.unlinked();
        }

        SortedSet<LaggedNode> targetParents = paths.parentsOf(Collections.singletonList(target));
        PathAndParents pp = pathAndParents(retained, target);
        SortedSet<LaggedNode> pathNodes = new TreeSet<>(pp.getPathNodes());

        SortedSet<LaggedNode> ptc = new TreeSet<>(targetParents);
        ptc.retainAll(pathNodes);

        SortedSet<LaggedNode> w = minus(targetParents, pathNodes);
        w.addAll(minus(pp.getParents(), pathNodes));

        List<Edge> removed = new ArrayList<>();

        if (transitive) {
            ReductionResult result = reduce(w, pathNodes);
            w = new TreeSet<>(result.getKept());
            removed.addAll(result.getRemovedEdges());
        }

        ConditionSet conditions = ConditionSet.derived(w);
        reportConditions("sources " + retained + " to " + target, conditions);
        return new CitComponents(conditions, ptc, pathNodes, retained, removed);
    }

    public BundledComponents searchBundledComponents(List<Integer> sourceVariables, LaggedNode target, int tau) {
        return searchBundledComponents(sourceVariables, target, tau, bundleLevel, transitive);
    }

    /**
     * Elements for the information transfer from a bundle of source variables to the target. The history of the
     * source variables is split at tau: the immediate history is lags 1..tau before the target, the distant history
     * everything older.
     *
     * @param sourceVariables the source variable indices.
     * @param tau             the number of steps in the immediate history; at least 1.
     * @param level           how much of the other variables to condition on: 0 nothing, 1 the target's parents, 2
     *                        also the parents of w and of the target's source parents.
     */
    public BundledComponents searchBundledComponents(List<Integer> sourceVariables, LaggedNode target, int tau,
                                                     int level, boolean transitive) {
        Validate.notNull(sourceVariables, "Source variables are null.");
        Validate.isTrue(!sourceVariables.isEmpty(), "Need at least one source variable.");
        codec.checkNode(target);

        if (tau < 1) {
            throw new IllegalArgumentException("tau must be at least 1: " + tau);
        }

        if (level < 0 || level > 2) {
            throw new IllegalArgumentException("Approximation level must be 0, 1 or 2: " + level);
        }

        SortedSet<Integer> sources = new TreeSet<>(sourceVariables);
        int horizon = target.getLag() - tau;

        for (int variable : sources) {
            codec.checkNode(new LaggedNode(variable, horizon));
        }

        SortedSet<LaggedNode> immediate = new TreeSet<>();

        for (int variable : sources) {
            for (int i = 1; i <= tau; i++) {
                immediate.add(new LaggedNode(variable, target.getLag() - i));
            }
        }

        SortedSet<LaggedNode> targetParents = paths.parentsOf(Collections.singletonList(target));

        SortedSet<LaggedNode> ptc = new TreeSet<>();
        SortedSet<LaggedNode> ptr = new TreeSet<>();

        for (LaggedNode parent : targetParents) {
            if (!sources.contains(parent.getVariable())) {
                ptr.add(parent);
            } else if (parent.getLag() >= horizon) {
                ptc.add(parent);
            }
        }

        SortedSet<LaggedNode> w = new TreeSet<>();

        for (LaggedNode parent : paths.parentsOf(immediate)) {
            if (parent.getLag() < horizon && sources.contains(parent.getVariable())) {
                w.add(parent);
            }
        }

        List<Edge> removed = new ArrayList<>();

        if (transitive) {
            ReductionResult result = reduce(w, immediate);
            w = new TreeSet<>(result.getKept());
            removed.addAll(result.getRemovedEdges());
        }

        SortedSet<LaggedNode> f = new TreeSet<>();
        SortedSet<LaggedNode> secondOrder = new TreeSet<>();
        List<Edge> removed2 = new ArrayList<>();

        if (level == 1 && sources.size() < codec.getNumVariables()) {
            f.addAll(ptr);
        } else if (level == 2 && sources.size() < codec.getNumVariables()) {
            secondOrder.addAll(outside(paths.parentsOf(w), sources));
            secondOrder.addAll(outside(paths.parentsOf(ptc), sources));

            if (transitive) {
                ReductionResult result = reduce(secondOrder, union(immediate, w));
                secondOrder = new TreeSet<>(result.getKept());
                removed2.addAll(result.getRemovedEdges());
            }

            f.addAll(secondOrder);
            f.addAll(ptr);
        }

        report(DiagnosticEvent.Type.CONDITIONS_FOUND, "Bundled components of " + sources + " to " + target
                + " at tau = " + tau + ", level = " + level + ": w = " + w + ", parents of the target in the "
                + "sources = " + ptc + ", conditions in the other variables = " + f, target);

        return new BundledComponents(w, ptc, f, secondOrder, removed, removed2);
    }

    public boolean isTransitive() {
        return transitive;
    }

    public void setTransitive(boolean transitive) {
        this.transitive = transitive;
    }

    public int getBundleLevel() {
        return bundleLevel;
    }

    public void setBundleLevel(int bundleLevel) {
        if (bundleLevel < 0 || bundleLevel > 2) {
            throw new IllegalArgumentException("Approximation level must be 0, 1 or 2: " + bundleLevel);
        }

        this.bundleLevel = bundleLevel;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    //==============================PRIVATE METHODS========================//

    private void checkNodes(LaggedNode... nodes) {
        for (LaggedNode node : nodes) {
            codec.checkNode(node);
        }
    }

    /**
     * Prunes w against those of its children that lie in the reference set.
     */
    private ReductionResult reduce(Collection<LaggedNode> w, Collection<LaggedNode> reference) {
        SortedSet<LaggedNode> children = paths.childrenOf(w);
        children.retainAll(reference);
        return reduction.reduce(w, children);
    }

    private List<LaggedNode> linkedSources(List<LaggedNode> sources, LaggedNode target) {
        List<LaggedNode> retained = new ArrayList<>();

        for (LaggedNode source : sources) {
            if (classifier.checkLinks(source, target, false).isLinked()) {
                if (!retained.contains(source)) retained.add(source);
            } else {
                report(DiagnosticEvent.Type.SOURCE_DROPPED, "The source " + source + " and the target " + target
                        + " are not linked by a causal path; dropping the source.", source, target);
            }
        }

        return retained;
    }

    /**
     * The union of the path nodes over several sources and the parents of that union. A path node of one source is
     * never a parent for the set.
     */
    private PathAndParents pathAndParents(List<LaggedNode> sources, LaggedNode target) {
        SortedSet<LaggedNode> pathNodes = new TreeSet<>();

        for (LaggedNode source : sources) {
            pathNodes.addAll(paths.causalPathNodes(source, target));
        }

        return new PathAndParents(paths.parentsOf(pathNodes), pathNodes);
    }

    private void reportConditions(String what, ConditionSet conditions) {
        report(DiagnosticEvent.Type.CONDITIONS_FOUND, "The number of conditions from " + what + " is "
                + conditions.size() + ", including: " + conditions.getNodes());
    }

    /**
     * Quiet searches report nothing.
     */
    private void report(DiagnosticEvent.Type type, String message, LaggedNode... nodes) {
        if (verbose) {
            sink.report(new DiagnosticEvent(type, message, nodes));
        }
    }

    private static SortedSet<LaggedNode> union(Collection<LaggedNode> a, Collection<LaggedNode> b) {
        SortedSet<LaggedNode> u = new TreeSet<>(a);
        u.addAll(b);
        return u;
    }

    private static SortedSet<LaggedNode> minus(Collection<LaggedNode> a, Collection<LaggedNode> b) {
        SortedSet<LaggedNode> d = new TreeSet<>(a);
        d.removeAll(b);
        return d;
    }

    private static SortedSet<LaggedNode> outside(Collection<LaggedNode> nodes, Collection<Integer> variables) {
        SortedSet<LaggedNode> result = new TreeSet<>();

        for (LaggedNode node : nodes) {
            if (!variables.contains(node.getVariable())) {
                result.add(node);
            }
        }

        return result;
    }
}
