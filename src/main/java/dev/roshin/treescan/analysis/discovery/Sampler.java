package dev.roshin.treescan.analysis.discovery;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import dev.roshin.treescan.analysis.model.CandidateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces a candidate list to at most {@code maxFiles} entries by stratified sampling.
 * <p>
 * Each category keeps a share proportional to its size, at least one file, and files
 * are taken at evenly spaced positions within the category. There is no randomness:
 * the result depends only on the candidate list and {@code maxFiles}.
 */
public class Sampler {
    private static final Logger log = LoggerFactory.getLogger(Sampler.class);

    /**
     * @param selected Chosen files, in their original order
     * @param sampled  Whether anything was dropped
     */
    public record Sample(List<CandidateFile> selected, boolean sampled) {
    }

    public Sample sample(List<CandidateFile> candidates, int maxFiles) {
        if (maxFiles <= 0) {
            throw new IllegalArgumentException("maxFiles must be positive, got: " + maxFiles);
        }
        if (candidates.size() <= maxFiles) {
            return new Sample(ImmutableList.copyOf(candidates), false);
        }

        ListMultimap<String, Integer> byCategory = MultimapBuilder.treeKeys().arrayListValues().build();
        for (int i = 0; i < candidates.size(); i++) {
            byCategory.put(candidates.get(i).category(), i);
        }

        Map<String, Integer> quotas = quotas(byCategory, candidates.size(), maxFiles);

        List<Integer> chosen = new ArrayList<>(maxFiles);
        quotas.forEach((category, quota) -> {
            List<Integer> members = byCategory.get(category);
            int size = members.size();
            for (int i = 0; i < quota; i++) {
                chosen.add(members.get((int) ((long) i * size / quota)));
            }
        });
        chosen.sort(Comparator.naturalOrder());

        ImmutableList.Builder<CandidateFile> selected = ImmutableList.builderWithExpectedSize(chosen.size());
        for (int index : chosen) {
            selected.add(candidates.get(index));
        }
        log.info("Sampled {} of {} candidates across {} categories: {}",
                chosen.size(), candidates.size(), byCategory.keySet().size(), quotas);
        return new Sample(selected.build(), true);
    }

    /**
     * Per-category file counts summing to {@code maxFiles}, in category name order.
     */
    static Map<String, Integer> quotas(ListMultimap<String, Integer> byCategory, int total, int maxFiles) {
        Map<String, Integer> quotas = new TreeMap<>();

        if (byCategory.keySet().size() >= maxFiles) {
            // not enough room for every category: one file each for the largest ones
            List<String> largest = new ArrayList<>(byCategory.keySet());
            largest.sort(Comparator.comparing((String c) -> byCategory.get(c).size()).reversed()
                    .thenComparing(Comparator.naturalOrder()));
            for (String category : largest.subList(0, maxFiles)) {
                quotas.put(category, 1);
            }
            return quotas;
        }

        int assigned = 0;
        for (String category : byCategory.keySet()) {
            int size = byCategory.get(category).size();
            int quota = Math.max(1, (int) ((long) size * maxFiles / total));
            quotas.put(category, quota);
            assigned += quota;
        }

        // floors of one can overshoot; take back from the largest quotas
        while (assigned > maxFiles) {
            String largest = null;
            for (Map.Entry<String, Integer> entry : quotas.entrySet()) {
                if (entry.getValue() > 1 && (largest == null || entry.getValue() > quotas.get(largest))) {
                    largest = entry.getKey();
                }
            }
            quotas.merge(largest, -1, Integer::sum);
            assigned--;
        }

        // hand out the rounding remainder round-robin
        List<String> categories = new ArrayList<>(quotas.keySet());
        int next = 0;
        while (assigned < maxFiles) {
            String category = categories.get(next);
            if (quotas.get(category) < byCategory.get(category).size()) {
                quotas.merge(category, 1, Integer::sum);
                assigned++;
            }
            next = (next + 1) % categories.size();
        }
        return quotas;
    }
}
