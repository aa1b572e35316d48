package eu.virtualparadox.reportparser.pattern;

import eu.virtualparadox.reportparser.position.MatchSpan;
import eu.virtualparadox.reportparser.section.SectionConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Default engine backed by {@link java.util.regex}.
 * Matching is case-insensitive with Unicode case folding. On JDK 17 {@code \b} also counts accented
 * letters as word characters; see {@link Re2jPatternEngine} for the ASCII-only alternative.
 */
public final class JdkPatternEngine implements PatternEngine {

    private static final int BASE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    @Override
    public CompiledPattern compile(final String regex, final boolean dotAll) {
        final int flags = dotAll ? BASE_FLAGS | Pattern.DOTALL : BASE_FLAGS;
        try {
            return new JdkCompiledPattern(Pattern.compile(regex, flags));
        } catch (PatternSyntaxException e) {
            throw new SectionConfigurationException("Invalid marker pattern: " + regex, e);
        }
    }

    private static final class JdkCompiledPattern implements CompiledPattern {

        private final Pattern pattern;

        JdkCompiledPattern(final Pattern pattern) {
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
            // Matcher.find() already steps past empty matches.
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
            return "jdk:" + pattern.pattern();
        }
    }
}
