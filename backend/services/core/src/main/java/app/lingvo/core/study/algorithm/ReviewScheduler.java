package app.lingvo.core.study.algorithm;

import app.lingvo.core.config.StudyProps;
import app.lingvo.core.study.domain.Score;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Interval doubling with a hint penalty.
 * <ul>
 *     <li>any hint used: score 0, interval 1 day, whatever was submitted;</li>
 *     <li>known: 1 day on the first success, then twice the previous interval up to the cap;</li>
 *     <li>not known: 1 day.</li>
 * </ul>
 * Pure: the outcome depends only on the arguments.
 */
@Component
public class ReviewScheduler {

    private static final int FIRST_INTERVAL_DAYS = 1;

    private final int maxIntervalDays;

    public ReviewScheduler(StudyProps props) {
        this.maxIntervalDays = props.maxIntervalDays();
    }

    public ReviewComputation advance(ReviewInput previous, Score score, boolean hintUsed, LocalDate today) {
        ReviewInput input = previous == null ? ReviewInput.NEW : previous;

        if (hintUsed) {
            return schedule(Score.DONT_KNOW, FIRST_INTERVAL_DAYS, today);
        }
        if (score == Score.KNOW) {
            return schedule(Score.KNOW, grow(input.checkInterval()), today);
        }
        return schedule(Score.DONT_KNOW, FIRST_INTERVAL_DAYS, today);
    }

    private int grow(int previousInterval) {
        if (previousInterval <= 0) {
            return Math.min(FIRST_INTERVAL_DAYS, maxIntervalDays);
        }
        long doubled = (long) previousInterval * 2;
        return (int) Math.min(doubled, maxIntervalDays);
    }

    private static ReviewComputation schedule(Score score, int intervalDays, LocalDate today) {
        return new ReviewComputation(score, intervalDays, today.plusDays(intervalDays));
    }

    public record ReviewInput(
            int score,
            int checkInterval,
            LocalDate nextCheckDate
    ) {
        public static final ReviewInput NEW = new ReviewInput(0, 0, null);

        public static ReviewInput from(ProgressRecordEntity record) {
            if (record == null) {
                return NEW;
            }
            return new ReviewInput(record.getScore(), record.getCheckInterval(), record.getNextCheckDate());
        }
    }

    public record ReviewComputation(
            Score score,
            int checkInterval,
            LocalDate nextCheckDate
    ) {
    }
}
