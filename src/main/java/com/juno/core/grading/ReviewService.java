package com.juno.core.grading;

import com.juno.core.model.TaskExecutionRecord;
import com.juno.core.oracle.GradeResult;
import com.juno.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the review step to a graded team output: the team's latest task
 * record receives its quality score, and the grade is filed under the task.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    public Map<String, Object> review(RunState state, String team, GradeResult grade) {
        var metrics = new ArrayList<>(state.metrics());
        String taskId = null;
        for (int i = metrics.size() - 1; i >= 0; i--) {
            TaskExecutionRecord record = metrics.get(i);
            if (record.teamName().equals(team)) {
                metrics.set(i, record.withQuality(grade.score()));
                taskId = record.taskId();
                break;
            }
        }
        if (taskId == null) {
            log.warn("No task record for team {} to review", team);
            return Map.of();
        }

        String key = reviewKey(taskId, team);
        var scores = new HashMap<>(state.reviewScores());
        scores.put(key, grade.score());
        var comments = new HashMap<>(state.reviewComments());
        comments.put(key, grade.comments());

        return Map.of(
                "metrics", List.copyOf(metrics),
                "reviewScores", Map.copyOf(scores),
                "reviewComments", Map.copyOf(comments));
    }

    public static String reviewKey(String taskId, String team) {
        return taskId + "/" + team;
    }
}
