package co.fanki.codegraph.analysis.domain;

import java.util.HashMap;
import java.util.Map;

/**
 * The tree-sitter node kinds the analyzer reacts to. Every grammar type
 * maps to exactly one kind; types the analyzer does not care about map
 * to {@link #OTHER} and are only descended into.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
enum SyntaxKind {

    FUNCTION_DECLARATION("function_declaration",
            "generator_function_declaration"),
    FUNCTION_EXPRESSION("function_expression", "function",
            "generator_function"),
    ARROW_FUNCTION("arrow_function"),
    METHOD_DEFINITION("method_definition"),
    CLASS("class_declaration", "abstract_class_declaration", "class"),
    CALL_EXPRESSION("call_expression"),
    NEW_EXPRESSION("new_expression"),
    THROW_STATEMENT("throw_statement"),
    TRY_STATEMENT("try_statement"),
    IF_STATEMENT("if_statement"),
    SWITCH_STATEMENT("switch_statement"),
    SWITCH_CASE("switch_case"),
    TERNARY_EXPRESSION("ternary_expression"),
    BINARY_EXPRESSION("binary_expression"),
    LOOP("for_statement", "for_in_statement", "while_statement",
            "do_statement"),
    RETURN_STATEMENT("return_statement"),
    VARIABLE_DECLARATION("lexical_declaration", "variable_declaration"),
    ASSIGNMENT_EXPRESSION("assignment_expression"),
    IMPORT_STATEMENT("import_statement"),
    OBJECT("object"),
    ARRAY("array"),
    LITERAL("string", "number", "true", "false", "null", "undefined",
            "regex"),
    TEMPLATE_STRING("template_string"),
    IDENTIFIER("identifier"),
    WRAPPER("parenthesized_expression", "as_expression",
            "satisfies_expression", "non_null_expression", "type_assertion",
            "await_expression"),
    OTHER();

    private static final Map<String, SyntaxKind> BY_TYPE = new HashMap<>();

    static {
        for (SyntaxKind kind : values()) {
            for (String type : kind.grammarTypes) {
                BY_TYPE.put(type, kind);
            }
        }
    }

    private final String[] grammarTypes;

    SyntaxKind(final String... theGrammarTypes) {
        grammarTypes = theGrammarTypes;
    }

    static SyntaxKind of(final String grammarType) {
        return BY_TYPE.getOrDefault(grammarType, OTHER);
    }

    boolean isFunction() {
        return this == FUNCTION_DECLARATION || this == FUNCTION_EXPRESSION
                || this == ARROW_FUNCTION || this == METHOD_DEFINITION;
    }

}
