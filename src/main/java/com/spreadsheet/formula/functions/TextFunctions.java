package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.models.Value;

import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * String functions. Positions and lengths count characters (code points),
 * not UTF-16 units. MID and FIND positions are 0-based; REPLACE is 1-based.
 */
final class TextFunctions {

    // Guards REPT against building enormous strings
    static final int MAX_TEXT_LENGTH = 1_000_000;

    private TextFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("CONCAT", args -> Value.string(args.stream()
                .map(Value::toString)
                .collect(Collectors.joining())));

        registry.register("LEN", args -> {
            Arguments.requireExactly("LEN", args, 1);
            String text = Arguments.text(args, 0);
            return Value.number(text.codePointCount(0, text.length()));
        });

        registerUnary(registry, "UPPER", text -> text.toUpperCase(Locale.ROOT));
        registerUnary(registry, "LOWER", text -> text.toLowerCase(Locale.ROOT));
        registerUnary(registry, "TRIM", String::strip);
        registerUnary(registry, "PROPER", TextFunctions::proper);
        registerUnary(registry, "CLEAN", text -> text.codePoints()
                .filter(cp -> !Character.isISOControl(cp))
                .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
                .toString());

        registry.register("CODE", args -> {
            Arguments.requireExactly("CODE", args, 1);
            String text = Arguments.text(args, 0);
            if (text.isEmpty()) {
                throw new EvaluationException("CODE requires a non-empty string");
            }
            return Value.number(text.codePointAt(0));
        });

        registry.register("CHAR", args -> {
            Arguments.requireExactly("CHAR", args, 1);
            double code = Arguments.number(args, 0);
            if (Double.isNaN(code) || code < 0 || code > Character.MAX_CODE_POINT) {
                throw new EvaluationException("CHAR: invalid character code " + Value.formatNumber(code));
            }
            int codePoint = (int) code;
            if (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE) {
                throw new EvaluationException("CHAR: invalid character code " + codePoint);
            }
            return Value.string(new String(Character.toChars(codePoint)));
        });

        registry.register("LEFT", args -> {
            Arguments.requireExactly("LEFT", args, 2);
            int[] chars = codePoints(Arguments.text(args, 0));
            int count = Math.min(Arguments.count(args, 1), chars.length);
            return Value.string(new String(chars, 0, count));
        });

        registry.register("RIGHT", args -> {
            Arguments.requireExactly("RIGHT", args, 2);
            int[] chars = codePoints(Arguments.text(args, 0));
            int count = Math.min(Arguments.count(args, 1), chars.length);
            return Value.string(new String(chars, chars.length - count, count));
        });

        registry.register("MID", args -> {
            Arguments.requireExactly("MID", args, 3);
            int[] chars = codePoints(Arguments.text(args, 0));
            int start = Math.min(Arguments.count(args, 1), chars.length);
            int length = Math.min(Arguments.count(args, 2), chars.length - start);
            return Value.string(new String(chars, start, length));
        });

        registry.register("FIND", args -> {
            Arguments.requireBetween("FIND", args, 2, 3);
            String search = Arguments.text(args, 0);
            int[] chars = codePoints(Arguments.text(args, 1));
            int start = args.size() == 3 ? Arguments.count(args, 2) : 0;
            if (start > chars.length) {
                throw new EvaluationException("FIND start position " + start + " is beyond the text length");
            }
            String tail = new String(chars, start, chars.length - start);
            int index = tail.indexOf(search);
            if (index < 0) {
                throw new EvaluationException("FIND could not find \"" + search + "\"");
            }
            return Value.number(start + tail.codePointCount(0, index));
        });

        registry.register("SUBSTITUTE", args -> {
            Arguments.requireExactly("SUBSTITUTE", args, 3);
            return Value.string(Arguments.text(args, 0).replace(Arguments.text(args, 1), Arguments.text(args, 2)));
        });

        registry.register("REPLACE", args -> {
            Arguments.requireExactly("REPLACE", args, 4);
            int[] chars = codePoints(Arguments.text(args, 0));
            int start = Math.min(Math.max(Arguments.count(args, 1) - 1, 0), chars.length);
            int end = (int) Math.min((long) start + Arguments.count(args, 2), chars.length);
            return Value.string(new String(chars, 0, start)
                    + Arguments.text(args, 3)
                    + new String(chars, end, chars.length - end));
        });

        registry.register("REPT", args -> {
            Arguments.requireExactly("REPT", args, 2);
            String text = Arguments.text(args, 0);
            int times = Arguments.count(args, 1);
            if ((long) text.length() * times > MAX_TEXT_LENGTH) {
                throw new EvaluationException("REPT result would exceed " + MAX_TEXT_LENGTH + " characters");
            }
            return Value.string(text.repeat(times));
        });

        registry.register("EXACT", args -> {
            Arguments.requireExactly("EXACT", args, 2);
            return Value.bool(Arguments.text(args, 0).equals(Arguments.text(args, 1)));
        });
    }

    private static void registerUnary(FunctionRegistry registry, String name, UnaryOperator<String> operator) {
        registry.register(name, args -> {
            Arguments.requireExactly(name, args, 1);
            return Value.string(operator.apply(Arguments.text(args, 0)));
        });
    }

    private static int[] codePoints(String text) {
        return text.codePoints().toArray();
    }

    // Word boundaries: start of text, whitespace, '-' and '_'
    private static String proper(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean wordStart = true;
        for (int cp : codePoints(text)) {
            if (Character.isLetter(cp)) {
                result.appendCodePoint(wordStart ? Character.toUpperCase(cp) : Character.toLowerCase(cp));
                wordStart = false;
            } else {
                result.appendCodePoint(cp);
                wordStart = Character.isWhitespace(cp) || cp == '-' || cp == '_';
            }
        }
        return result.toString();
    }
}
