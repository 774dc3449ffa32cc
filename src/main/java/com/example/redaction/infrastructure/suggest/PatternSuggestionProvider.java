package com.example.redaction.infrastructure.suggest;

import com.example.redaction.domain.model.ContextualMatch;
import com.example.redaction.domain.model.RedactionKind;
import com.example.redaction.domain.model.RedactionRequest;
import com.example.redaction.domain.service.OccurrenceFinder;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline suggestion provider built on regular expressions.
 * <p>
 * Candidates carry a fixed confidence per pattern; the sensitivity lowers the confidence a candidate needs
 * to be returned, from 95 at sensitivity 0 down to 60 at sensitivity 100. Contextual matches cover the usual
 * ways a person is referred to again (honorific or initial plus surname, bare surname, other letter case)
 * and differently punctuated spellings of digit sequences.
 */
@Component
public class PatternSuggestionProvider implements SuggestionProvider {

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("\\b[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}\\b", Pattern.CASE_INSENSITIVE),
                    0, RedactionKind.PII, 95, "E-mail address", value -> true),
            new Rule(Pattern.compile("(?<!\\d)\\d{3}-\\d{2}-\\d{4}(?!\\d)"),
                    0, RedactionKind.PII, 95, "US social security number", value -> true),
            new Rule(Pattern.compile("(?<![\\d-])(?:\\+1[ .-]?)?(?:\\(\\d{3}\\)|\\d{3})[ .-]?\\d{3}[ .-]\\d{4}(?![\\d-])"),
                    0, RedactionKind.PII, 70, "Phone number", value -> true),
            new Rule(Pattern.compile("(?<!\\d)(\\d[\\d -]{11,20}\\d)(?!\\d)"),
                    1, RedactionKind.FINANCIAL, 90, "Payment card number (Luhn valid)",
                    PatternSuggestionProvider::isCardNumber),
            new Rule(Pattern.compile("(?<![A-Z0-9])([A-Z]{2}\\d{2}(?: ?[A-Z0-9]{4}){2,7}(?: ?[A-Z0-9]{1,3})?)(?![A-Z0-9])"),
                    1, RedactionKind.FINANCIAL, 85, "IBAN account number",
                    PatternSuggestionProvider::isIban),
            new Rule(Pattern.compile("(?i)\\b(?:password|passwd|pwd|secret|passphrase|token|api[_-]?key)\\s*[:=]\\s*([^\\s,;]{1,256})"),
                    1, RedactionKind.CREDENTIALS, 80, "Credential assigned to a secret-looking key", value -> true)
    );

    private static final List<String> HONORIFICS = List.of("Mr.", "Mrs.", "Ms.", "Dr.", "Mr", "Mrs", "Ms", "Dr");
    private static final Pattern NAME_TOKEN = Pattern.compile("\\p{L}[\\p{L}'-]*");
    private static final int MIN_DIGITS_FOR_SPELLINGS = 6;

    @Override
    public List<RedactionRequest> suggest(String documentText, int sensitivity) {
        int minConfidence = 95 - (35 * Math.max(0, Math.min(100, sensitivity))) / 100;
        Map<String, RedactionRequest> found = new LinkedHashMap<>();
        if (documentText == null || documentText.isEmpty()) {
            return List.of();
        }
        for (Rule rule : RULES) {
            if (rule.confidence() < minConfidence) {
                continue;
            }
            Matcher matcher = rule.pattern().matcher(documentText);
            while (matcher.find()) {
                String value = matcher.group(rule.group()).trim();
                if (value.isEmpty() || !rule.validator().test(value)) {
                    continue;
                }
                found.putIfAbsent(value + '\u0000' + rule.kind(),
                        new RedactionRequest(value, rule.kind(), rule.confidence(), rule.reason()));
            }
        }
        return new ArrayList<>(found.values());
    }

    @Override
    public List<ContextualMatch> findContextual(String documentText, String seedText, RedactionKind kind) {
        if (documentText == null || documentText.isEmpty() || seedText == null || seedText.isBlank()) {
            return List.of();
        }
        String seed = seedText.trim();
        Map<String, ContextualMatch> proposals = new LinkedHashMap<>();

        addIfPresent(documentText, seed, seed.toUpperCase(Locale.ROOT), 90, "Same text in upper case", proposals);
        addIfPresent(documentText, seed, seed.toLowerCase(Locale.ROOT), 90, "Same text in lower case", proposals);

        List<String> tokens = nameTokens(seed);
        if (tokens.size() >= 2) {
            String given = tokens.get(0);
            String surname = tokens.get(tokens.size() - 1);
            for (String honorific : HONORIFICS) {
                addIfPresent(documentText, seed, honorific + " " + surname, 85, "Honorific with the same surname", proposals);
            }
            addIfPresent(documentText, seed, given.charAt(0) + ". " + surname, 80, "Initial with the same surname", proposals);
            addIfPresent(documentText, seed, surname + ", " + given, 80, "Surname-first spelling", proposals);
            if (surname.length() >= 3) {
                addIfPresent(documentText, seed, surname, 60, "Surname mentioned on its own", proposals);
            }
        }

        String digits = seed.replaceAll("\\D", "");
        if (digits.length() >= MIN_DIGITS_FOR_SPELLINGS && digits.length() * 2 >= seed.length()) {
            Matcher matcher = digitSpelling(digits).matcher(documentText);
            while (matcher.find()) {
                String candidate = matcher.group();
                if (!candidate.equals(seed)) {
                    proposals.putIfAbsent(candidate, new ContextualMatch(candidate, 85, "Same digits with different separators"));
                }
            }
        }
        return new ArrayList<>(proposals.values());
    }

    private static void addIfPresent(String text, String seed, String variant, int confidence, String reason,
                                     Map<String, ContextualMatch> proposals) {
        if (variant.equals(seed) || proposals.containsKey(variant)) {
            return;
        }
        if (!OccurrenceFinder.findWholeWords(text, variant).isEmpty()) {
            proposals.put(variant, new ContextualMatch(variant, confidence, reason));
        }
    }

    private static List<String> nameTokens(String seed) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = NAME_TOKEN.matcher(seed);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        // anything besides letters, spaces and dots is not a name
        return seed.matches("[\\p{L}'. -]+") ? tokens : List.of();
    }

    private static Pattern digitSpelling(String digits) {
        StringBuilder regex = new StringBuilder("(?<!\\d)");
        for (int i = 0; i < digits.length(); i++) {
            if (i > 0) {
                regex.append("[\\s.-]?");
            }
            regex.append(digits.charAt(i));
        }
        return Pattern.compile(regex.append("(?!\\d)").toString());
    }

    static boolean isCardNumber(String value) {
        String digits = value.replaceAll("[\\s-]", "");
        return digits.length() >= 13 && digits.length() <= 19 && luhn(digits);
    }

    private static boolean luhn(String digits) {
        int sum = 0;
        boolean doubled = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int digit = digits.charAt(i) - '0';
            if (doubled) {
                digit += digit;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubled = !doubled;
        }
        return sum % 10 == 0;
    }

    /**
     * ISO 13616 MOD-97 check on the normalized account number.
     */
    static boolean isIban(String value) {
        String iban = value.replace(" ", "").toUpperCase(Locale.ROOT);
        if (iban.length() < 15 || iban.length() > 34) {
            return false;
        }
        String rearranged = iban.substring(4) + iban.substring(0, 4);
        int remainder = 0;
        for (int i = 0; i < rearranged.length(); i++) {
            char ch = rearranged.charAt(i);
            if (ch >= '0' && ch <= '9') {
                remainder = (remainder * 10 + (ch - '0')) % 97;
            } else {
                int v = ch - 'A' + 10;
                remainder = (remainder * 100 + v) % 97;
            }
        }
        return remainder == 1;
    }

    private record Rule(Pattern pattern, int group, RedactionKind kind, int confidence, String reason,
                        Predicate<String> validator) {
    }
}
