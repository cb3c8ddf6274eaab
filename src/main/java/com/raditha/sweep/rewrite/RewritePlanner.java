package com.raditha.sweep.rewrite;

import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.RemovalSpan;
import com.raditha.sweep.model.WriteSite;
import com.raditha.sweep.scope.BlockInfo;
import com.raditha.sweep.scope.ScopeGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns dead bindings into line spans to delete.
 * <p>
 * A binding is removed as a whole or not at all. It is kept, with an
 * UNREMOVABLE_BINDING warning, when one of its statements cannot be deleted as
 * whole lines, when a statement it shares also writes a binding that stays, or when
 * deleting would leave a block that needs a statement empty. Keeping one binding
 * can keep others, so the checks repeat until nothing changes.
 */
public class RewritePlanner {
    private static final Logger logger = LoggerFactory.getLogger(RewritePlanner.class);

    private final ReassignmentPolicy policy;

    public RewritePlanner() {
        this(ReassignmentPolicy.ALL_WRITES);
    }

    public RewritePlanner(ReassignmentPolicy policy) {
        this.policy = policy;
    }

    public ReassignmentPolicy getPolicy() {
        return policy;
    }

    public RemovalPlan plan(ScopeGraph graph, List<Binding> dead) {
        if (dead.isEmpty()) {
            return RemovalPlan.empty();
        }
        Map<Integer, List<Binding>> owners = siteOwners(graph);
        Set<Binding> candidates = new LinkedHashSet<>(dead);
        List<ErrorRecord> warnings = new ArrayList<>();

        boolean changed = true;
        while (changed) {
            changed = dropUnremovableSites(candidates, warnings)
                    | dropSharedWithLive(candidates, owners, warnings)
                    | keepBlocksNonEmpty(graph, candidates, owners, warnings);
        }

        Map<Integer, WriteSite> sites = scheduledSites(candidates);
        List<RemovalSpan> spans = new ArrayList<>();
        for (WriteSite site : sites.values()) {
            List<Binding> reasons = owners.get(site.siteId()).stream().filter(candidates::contains).toList();
            spans.add(new RemovalSpan(site.startLine(), site.endLine(), reasons));
        }
        List<RemovalSpan> merged = merge(spans);
        logger.debug("Planned {} span(s) for {} dead binding(s), kept {}", merged.size(), candidates.size(),
                dead.size() - candidates.size());
        return new RemovalPlan(merged, new ArrayList<>(candidates), warnings);
    }

    /**
     * Sort spans and merge those that overlap or touch.
     */
    public static List<RemovalSpan> merge(List<RemovalSpan> spans) {
        List<RemovalSpan> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt(RemovalSpan::startLine).thenComparingInt(RemovalSpan::endLine));
        List<RemovalSpan> merged = new ArrayList<>();
        for (RemovalSpan span : sorted) {
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).touches(span)) {
                merged.set(last, merged.get(last).mergeWith(span));
            } else {
                merged.add(span);
            }
        }
        return merged;
    }

    private boolean dropUnremovableSites(Set<Binding> candidates, List<ErrorRecord> warnings) {
        boolean changed = false;
        for (Binding binding : List.copyOf(candidates)) {
            for (WriteSite site : policy.sitesToRemove(binding)) {
                if (!site.isRemovable()) {
                    keep(binding, site.unremovableReason(), site.startLine(), candidates, warnings);
                    changed = true;
                    break;
                }
            }
        }
        return changed;
    }

    private boolean dropSharedWithLive(Set<Binding> candidates, Map<Integer, List<Binding>> owners,
                                       List<ErrorRecord> warnings) {
        boolean changed = false;
        for (Binding binding : List.copyOf(candidates)) {
            for (WriteSite site : policy.sitesToRemove(binding)) {
                Binding live = owners.get(site.siteId()).stream()
                        .filter(owner -> !candidates.contains(owner))
                        .findFirst()
                        .orElse(null);
                if (live != null) {
                    keep(binding, "shares a statement with '" + live.getName() + "', which is kept",
                            site.startLine(), candidates, warnings);
                    changed = true;
                    break;
                }
            }
        }
        return changed;
    }

    private boolean keepBlocksNonEmpty(ScopeGraph graph, Set<Binding> candidates,
                                       Map<Integer, List<Binding>> owners, List<ErrorRecord> warnings) {
        Map<Integer, List<WriteSite>> byBlock = new HashMap<>();
        for (WriteSite site : scheduledSites(candidates).values()) {
            if (site.blockId() != WriteSite.NO_BLOCK) {
                byBlock.computeIfAbsent(site.blockId(), k -> new ArrayList<>()).add(site);
            }
        }
        boolean changed = false;
        for (Map.Entry<Integer, List<WriteSite>> entry : byBlock.entrySet()) {
            BlockInfo block = graph.block(entry.getKey()).orElse(null);
            if (block == null || !block.requiresStatement() || entry.getValue().size() < block.statementCount()) {
                continue;
            }
            WriteSite lastInBlock = entry.getValue().stream()
                    .max(Comparator.comparingInt(WriteSite::startLine))
                    .orElseThrow();
            for (Binding owner : owners.get(lastInBlock.siteId())) {
                if (candidates.contains(owner)) {
                    keep(owner, "is the last statement of its block", lastInBlock.startLine(), candidates, warnings);
                    changed = true;
                }
            }
        }
        return changed;
    }

    private Map<Integer, WriteSite> scheduledSites(Set<Binding> candidates) {
        Map<Integer, WriteSite> sites = new LinkedHashMap<>();
        for (Binding binding : candidates) {
            for (WriteSite site : policy.sitesToRemove(binding)) {
                sites.putIfAbsent(site.siteId(), site);
            }
        }
        return sites;
    }

    private static Map<Integer, List<Binding>> siteOwners(ScopeGraph graph) {
        Map<Integer, List<Binding>> owners = new HashMap<>();
        for (Binding binding : graph.allBindings()) {
            for (WriteSite site : binding.getWrites()) {
                owners.computeIfAbsent(site.siteId(), k -> new ArrayList<>()).add(binding);
            }
        }
        return owners;
    }

    private static void keep(Binding binding, String reason, int line, Set<Binding> candidates,
                             List<ErrorRecord> warnings) {
        candidates.remove(binding);
        warnings.add(ErrorRecord.unremovable("'" + binding.getName() + "' is never read but " + reason
                + "; keeping it", line));
    }
}
