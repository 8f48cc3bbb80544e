package com.treasurylens.job;

import com.treasurylens.config.TreasuryLensProperties;
import com.treasurylens.domain.Chain;
import com.treasurylens.ruleset.RulesetService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Polls the cycle number of watched projects and drops their cached rulesets when a new cycle starts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CycleWatchJob {

    private final RulesetService rulesetService;
    private final TreasuryLensProperties properties;

    @Scheduled(
            fixedDelayString = "${treasurylens.watch.poll-interval-ms:60000}",
            initialDelayString = "${treasurylens.watch.poll-interval-ms:60000}")
    public void runScheduled() {
        int changed = pollWatched();
        if (changed > 0) {
            log.info("Cycle watch: {} project(s) entered a new cycle", changed);
        }
    }

    /**
     * One pass over the watched projects, sequentially. Returns how many changed cycle.
     */
    public int pollWatched() {
        List<WatchedProject> watched = watchedProjects(properties.getWatch().getProjects());
        if (watched.isEmpty()) {
            return 0;
        }
        Long changed = Flux.fromIterable(watched)
                .concatMap(p -> rulesetService.refreshIfCycleChanged(p.chain(), p.projectId())
                        .onErrorResume(e -> {
                            log.warn("Cycle watch for project {} on chain {} failed: {}",
                                    p.projectId(), p.chain().getId(), e.getMessage());
                            return Mono.just(false);
                        }))
                .filter(Boolean::booleanValue)
                .count()
                .block();
        return changed != null ? changed.intValue() : 0;
    }

    static List<WatchedProject> watchedProjects(List<String> entries) {
        List<WatchedProject> result = new ArrayList<>();
        if (entries == null) {
            return result;
        }
        for (String entry : entries) {
            parse(entry).ifPresentOrElse(result::add,
                    () -> log.warn("Ignoring watch entry '{}', expected chainId:projectId on a supported chain", entry));
        }
        return result;
    }

    static Optional<WatchedProject> parse(String entry) {
        if (entry == null) {
            return Optional.empty();
        }
        String[] parts = entry.strip().split(":");
        if (parts.length != 2) {
            return Optional.empty();
        }
        try {
            long chainId = Long.parseLong(parts[0].strip());
            long projectId = Long.parseLong(parts[1].strip());
            return Chain.fromId(chainId).map(chain -> new WatchedProject(chain, projectId));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    record WatchedProject(Chain chain, long projectId) {
    }
}
