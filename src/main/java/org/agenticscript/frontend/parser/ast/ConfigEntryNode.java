package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * A {@code key: value} pair of an agent constructor.
 */
public record ConfigEntryNode(String key, AstNode value, SourceInfo sourceInfo) implements AstNode {
}
