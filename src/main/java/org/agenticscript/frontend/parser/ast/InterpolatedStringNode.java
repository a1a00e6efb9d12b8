package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.List;

/**
 * An AST node for {@code f"text {expression} text"}.
 *
 * @param segments The literal and embedded segments, in source order.
 * @param sourceInfo The position of the literal.
 */
public record InterpolatedStringNode(List<Segment> segments, SourceInfo sourceInfo) implements AstNode {

    public InterpolatedStringNode {
        segments = List.copyOf(segments);
    }

    /**
     * A part of an interpolated string.
     */
    public sealed interface Segment {

        /** Literal text with escapes and doubled braces already resolved. */
        record Text(String text) implements Segment {}

        /** An embedded expression whose printed form is inserted. */
        record Embedded(AstNode expression) implements Segment {}
    }
}
