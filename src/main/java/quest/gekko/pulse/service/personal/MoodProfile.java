package quest.gekko.pulse.service.personal;

import quest.gekko.pulse.domain.Mood;

import java.util.List;

/**
 * How one mood reads an item. An item "matches" when it contains any keyword, or when it reads as an
 * explainer / live story and the matching flag is set; a match adds {@code matchAffinity}.
 *
 * @param quietBonus  added when the item does not read as live or breaking
 * @param recencyBand optional age-dependent adjustment, may be null
 * @param lookbackHours default number of snapshot hours pooled for this mood
 * @param tone        marker prefixed to personalized summaries
 */
public record MoodProfile(Mood mood,
                          List<String> keywords,
                          boolean explainerMatches,
                          boolean liveMatches,
                          double matchAffinity,
                          double quietBonus,
                          RecencyBand recencyBand,
                          int lookbackHours,
                          String tone) {

    /** {@code inside} applies when {@code minHours <= h <= maxHours}, {@code outside} otherwise. */
    public record RecencyBand(double minHours, double maxHours, double inside, double outside) {
        public double bonus(double hours) {
            return hours >= minHours && hours <= maxHours ? inside : outside;
        }
    }
}
