package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Argument expressions. The set of kinds is closed; lowering matches on it exhaustively.
 */
public sealed interface Expression extends AstNode {

    record StringLiteral(String value, SourceInfo source) implements Expression {}

    record NumberLiteral(double value, SourceInfo source) implements Expression {}

    record BooleanLiteral(boolean value, SourceInfo source) implements Expression {}

    record NullLiteral(SourceInfo source) implements Expression {}

    record ArrayLiteral(List<Expression> elements, SourceInfo source) implements Expression {
        public ArrayLiteral {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }
    }

    /**
     * An object literal. Entry order is preserved.
     */
    record ObjectLiteral(Map<String, Expression> entries, SourceInfo source) implements Expression {
        public ObjectLiteral {
            entries = entries != null ? java.util.Collections.unmodifiableMap(new LinkedHashMap<>(entries)) : Map.of();
        }
    }

    /**
     * A runtime property reference such as {@code $operationdata.items}; the segments
     * exclude the leading {@code $}.
     */
    record PropertyChain(List<String> segments, SourceInfo source) implements Expression {
        public PropertyChain {
            segments = List.copyOf(segments);
        }

        /**
         * @return The reference as the runtime expects it, e.g. {@code $scope.item}.
         */
        public String text() {
            return "$" + String.join(".", segments);
        }
    }

    /**
     * The current item inside a stagger block.
     */
    record ItemReference(SourceInfo source) implements Expression {}
}
