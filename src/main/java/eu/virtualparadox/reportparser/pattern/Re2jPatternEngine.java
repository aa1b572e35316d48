package eu.virtualparadox.reportparser.pattern;

import com.google.re2j.Matcher;
import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;
import eu.virtualparadox.reportparser.position.MatchSpan;
import eu.virtualparadox.reportparser.section.SectionConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Linear-time engine backed by RE2/J.
 * <p>RE2 guarantees matching time linear in the input, at the cost of rejecting
 * backreferences and lookaround. Markers using those constructs fail to compile here.</p>
 * <p>{@code \b} and {@code \w} are ASCII-only. With word boundaries enabled, a marker next to an
 * accented letter ({@code éhistory}) still matches, and a marker starting or ending with one
 * ({@code ärger}) does not. The JDK engine treats those letters as word characters, so the two
 * engines are only interchangeable on ASCII headings.</p>
 */
public final class Re2jPatternEngine implements PatternEngine {

    @Override
    public CompiledPattern compile(final String regex, final boolean dotAll) {
        final int flags = dotAll ? Pattern.CASE_INSENSITIVE | Pattern.DOTALL : Pattern.CASE_INSENSITIVE;
        try {
            return new Re2jCompiledPattern(Pattern.compile(regex, flags));
        } catch (PatternSyntaxException e) {
            throw new SectionConfigurationException("Invalid marker pattern for RE2/J: " + regex, e);
        }
    }

    private static final class Re2jCompiledPattern implements CompiledPattern {

        private final Pattern pattern;

        Re2jCompiledPattern(final Pattern pattern) {
            this.pattern = pattern;
        }

        @Override
        public String pattern() {
            return pattern.pattern();
        }

        @Override
        public Optional<MatchSpan> findFirst(final String text) {
            final Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                return Optional.empty();
            }
            return Optional.of(new MatchSpan(matcher.start(), matcher.end()));
        }

        @Override
        public List<MatchSpan> findAll(final String text) {
            final List<MatchSpan> spans = new ArrayList<>();
            final Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                spans.add(new MatchSpan(matcher.start(), matcher.end()));
            }
            return spans;
        }

        @Override
        public Optional<String> firstGroup(final String text, final int group) {
            final Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                return Optional.empty();
            }
            return Optional.ofNullable(matcher.group(group));
        }

        @Override
        public String toString() {
            return "re2j:" + pattern.pattern();
        }
    }
}
