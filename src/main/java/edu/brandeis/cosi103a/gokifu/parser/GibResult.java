package edu.brandeis.cosi103a.gokifu.parser;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the result code and score pair that GIB headers record.
 */
final class GibResult {

    private static final Map<Integer, String> FIXED_RESULTS = Map.of(
        3, "B+R",
        4, "W+R",
        7, "B+T",
        8, "W+T"
    );

    private GibResult() {}

    /**
     * @param code  the result code; 0 and 1 are wins on points for Black and White
     * @param score the margin in tenths of a point
     */
    static Optional<String> of(int code, int score) {
        if (FIXED_RESULTS.containsKey(code)) {
            return Optional.of(FIXED_RESULTS.get(code));
        }
        if (code == 0 || code == 1) {
            return Optional.of((code == 0 ? "B+" : "W+") + Numbers.tenths(score));
        }
        return Optional.empty();
    }

    /**
     * Finds a result in a header line given the patterns for its code and score fields.
     * Both fields must be present.
     */
    static Optional<String> find(String line, Pattern codePattern, Pattern scorePattern) {
        Matcher code = codePattern.matcher(line);
        Matcher score = scorePattern.matcher(line);
        if (!code.find() || !score.find()) {
            return Optional.empty();
        }
        return Numbers.leadingInt(code.group(1))
            .flatMap(c -> Numbers.leadingInt(score.group(1)).flatMap(s -> of(c, s)));
    }
}
