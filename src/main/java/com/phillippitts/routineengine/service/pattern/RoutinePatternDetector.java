package com.phillippitts.routineengine.service.pattern;

import com.phillippitts.routineengine.config.properties.PatternDetectionProperties;
import com.phillippitts.routineengine.domain.RoutineAction;
import com.phillippitts.routineengine.domain.RoutineDefinition;
import com.phillippitts.routineengine.domain.RoutinePattern;
import com.phillippitts.routineengine.domain.RoutineTrigger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mines completed-task history for recurring behaviour and suggests routines that automate it.
 *
 * <p><b>Temporal:</b> tasks are grouped by the local hour they were completed. In a group of at least
 * {@code minOccurrences} tasks, the most frequent title (itself seen at least {@code minOccurrences}
 * times) yields a pattern with confidence {@code hits / groupSize}, kept when at or above the
 * confidence threshold.
 *
 * <p><b>Sequential:</b> tasks sorted by completion time are scanned as consecutive title pairs. A
 * pair seen at least {@code minOccurrences} times yields a pattern with confidence
 * {@code occurrences / taskCount}, kept when at or above the sequential floor.
 *
 * <p>Every returned pattern at or above the confidence threshold is also published as a
 * {@link RoutinePatternDetectedEvent}. Patterns are suggestions only; nothing is created.
 */
@Component
public class RoutinePatternDetector {

    private static final Logger LOG = LogManager.getLogger(RoutinePatternDetector.class);

    static final List<String> TEMPORAL_TAGS = List.of("auto-detected", "temporal");
    static final List<String> SEQUENTIAL_TAGS = List.of("auto-detected", "sequential");

    private final PatternDetectionProperties props;
    private final CompletedTaskSource tasks;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public RoutinePatternDetector(PatternDetectionProperties props,
                                  @Nullable CompletedTaskSource tasks,
                                  ApplicationEventPublisher publisher,
                                  Clock clock) {
        this.props = props;
        this.tasks = tasks;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Periodic detection; does nothing when {@code routines.patterns.enabled=false}.
     */
    @Scheduled(fixedDelayString = "${routines.patterns.check-interval:PT1H}",
            initialDelayString = "${routines.patterns.check-interval:PT1H}")
    public void scheduledCheck() {
        if (!props.isEnabled()) {
            return;
        }
        try {
            detectPatterns();
        } catch (RuntimeException e) {
            LOG.error("Pattern detection failed", e);
        }
    }

    /**
     * Runs both detectors over the current history.
     *
     * @return temporal patterns followed by sequential ones
     */
    public List<RoutinePattern> detectPatterns() {
        if (tasks == null) {
            LOG.debug("No completed-task source configured; skipping pattern detection");
            return List.of();
        }
        List<CompletedTask> history = tasks.completedTasks();
        if (history == null || history.isEmpty()) {
            return List.of();
        }

        List<RoutinePattern> patterns = new ArrayList<>();
        patterns.addAll(detectTemporal(history));
        patterns.addAll(detectSequential(history));

        if (!patterns.isEmpty()) {
            LOG.info("Detected {} routine pattern(s) in {} completed task(s)", patterns.size(), history.size());
        }
        for (RoutinePattern p : patterns) {
            if (p.confidence() >= props.getConfidenceThreshold()) {
                publisher.publishEvent(new RoutinePatternDetectedEvent(p, clock.instant()));
            }
        }
        return patterns;
    }

    List<RoutinePattern> detectTemporal(List<CompletedTask> history) {
        Map<Integer, List<CompletedTask>> byHour = new TreeMap<>();
        for (CompletedTask t : history) {
            int hour = t.completedAt().atZone(clock.getZone()).getHour();
            byHour.computeIfAbsent(hour, h -> new ArrayList<>()).add(t);
        }

        int min = props.getMinOccurrences();
        List<RoutinePattern> out = new ArrayList<>();
        for (Map.Entry<Integer, List<CompletedTask>> e : byHour.entrySet()) {
            List<CompletedTask> group = e.getValue();
            if (group.size() < min) {
                continue;
            }
            Map.Entry<String, Integer> top = mostCommonTitle(group);
            if (top == null || top.getValue() < min) {
                continue;
            }
            double confidence = (double) top.getValue() / group.size();
            if (confidence < props.getConfidenceThreshold()) {
                continue;
            }
            int hour = e.getKey();
            String title = top.getKey();
            RoutineDefinition suggestion = new RoutineDefinition(
                    "Daily " + title,
                    "Automatically remind or create task \"" + title + "\" at " + hour + ":00",
                    RoutineTrigger.time("every day at " + hour + ":00"),
                    List.of(),
                    List.of(RoutineAction.notification("Time for: " + title)),
                    TEMPORAL_TAGS,
                    null);
            out.add(new RoutinePattern(RoutinePattern.Type.TEMPORAL,
                    "You often complete tasks like \"" + title + "\" around " + hour
                            + ":00. Would you like to create a routine for this?",
                    top.getValue(), confidence, suggestion));
        }
        return out;
    }

    List<RoutinePattern> detectSequential(List<CompletedTask> history) {
        List<CompletedTask> sorted = history.stream()
                .sorted(Comparator.comparing(CompletedTask::completedAt))
                .toList();

        Map<List<String>, Integer> pairCounts = new LinkedHashMap<>();
        for (int i = 0; i + 1 < sorted.size(); i++) {
            List<String> pair = List.of(sorted.get(i).title(), sorted.get(i + 1).title());
            pairCounts.merge(pair, 1, Integer::sum);
        }

        List<RoutinePattern> out = new ArrayList<>();
        for (Map.Entry<List<String>, Integer> e : pairCounts.entrySet()) {
            int occurrences = e.getValue();
            if (occurrences < props.getMinOccurrences()) {
                continue;
            }
            double confidence = (double) occurrences / sorted.size();
            if (confidence < props.getSequentialConfidenceFloor()) {
                continue;
            }
            String first = e.getKey().get(0);
            String next = e.getKey().get(1);
            RoutineDefinition suggestion = new RoutineDefinition(
                    "Workflow: " + first + " -> " + next,
                    "Automated workflow for: " + first + ", " + next,
                    RoutineTrigger.completion(first),
                    List.of(),
                    List.of(RoutineAction.notification("Next step: " + next)),
                    SEQUENTIAL_TAGS,
                    null);
            out.add(new RoutinePattern(RoutinePattern.Type.SEQUENTIAL,
                    "You often complete tasks in this sequence: " + first + " -> " + next
                            + ". Would you like to create a routine for this workflow?",
                    occurrences, Math.min(1.0, confidence), suggestion));
        }
        return out;
    }

    /** First-seen title wins ties. */
    private static Map.Entry<String, Integer> mostCommonTitle(List<CompletedTask> group) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CompletedTask t : group) {
            counts.merge(t.title(), 1, Integer::sum);
        }
        Map.Entry<String, Integer> best = null;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (best == null || e.getValue() > best.getValue()) {
                best = e;
            }
        }
        return best;
    }
}
