package org.hexscript.interpreter.statement;

import org.hexscript.interpreter.frontend.lexer.LexicalRules;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits program text into statements on the terminator character.
 * <p>
 * Segments that are blank after trimming are dropped. Text after the last terminator
 * forms a final, unterminated segment when it is not blank. Comments get no special
 * treatment: a '//' comment ends at the next terminator like any other statement.
 */
public class StatementSplitter {

    /**
     * @param source The complete program text.
     * @return The non-blank segments, in source order.
     */
    public List<StatementSegment> split(String source) {
        List<StatementSegment> segments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == LexicalRules.TERMINATOR) {
                addIfNotBlank(segments, source.substring(start, i), start, true);
                start = i + 1;
            }
        }
        if (start < source.length()) {
            addIfNotBlank(segments, source.substring(start), start, false);
        }
        return segments;
    }

    private static void addIfNotBlank(List<StatementSegment> segments, String text, int offset, boolean terminated) {
        if (!text.trim().isEmpty()) {
            segments.add(new StatementSegment(text, offset, terminated));
        }
    }
}
