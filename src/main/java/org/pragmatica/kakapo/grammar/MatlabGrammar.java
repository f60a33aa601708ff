package org.pragmatica.kakapo.grammar;

import org.pragmatica.kakapo.action.Parts;
import org.pragmatica.kakapo.tree.AnonymousFunction;
import org.pragmatica.kakapo.tree.ArgumentDeclaration;
import org.pragmatica.kakapo.tree.ArgumentsBlock;
import org.pragmatica.kakapo.tree.ArgumentsList;
import org.pragmatica.kakapo.tree.Array;
import org.pragmatica.kakapo.tree.Call;
import org.pragmatica.kakapo.tree.Case;
import org.pragmatica.kakapo.tree.CatchClause;
import org.pragmatica.kakapo.tree.Classdef;
import org.pragmatica.kakapo.tree.Clause;
import org.pragmatica.kakapo.tree.Code;
import org.pragmatica.kakapo.tree.Command;
import org.pragmatica.kakapo.tree.Comment;
import org.pragmatica.kakapo.tree.DelimitedList;
import org.pragmatica.kakapo.tree.ElseClause;
import org.pragmatica.kakapo.tree.ElseIfClause;
import org.pragmatica.kakapo.tree.File;
import org.pragmatica.kakapo.tree.ForLoop;
import org.pragmatica.kakapo.tree.Function;
import org.pragmatica.kakapo.tree.If;
import org.pragmatica.kakapo.tree.Leaf;
import org.pragmatica.kakapo.tree.Methods;
import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.Operation;
import org.pragmatica.kakapo.tree.OutputArguments;
import org.pragmatica.kakapo.tree.Parenthesized;
import org.pragmatica.kakapo.tree.PostfixOperation;
import org.pragmatica.kakapo.tree.PrefixOperation;
import org.pragmatica.kakapo.tree.Properties;
import org.pragmatica.kakapo.tree.Spmd;
import org.pragmatica.kakapo.tree.Statement;
import org.pragmatica.kakapo.tree.Switch;
import org.pragmatica.kakapo.tree.Terminator;
import org.pragmatica.kakapo.tree.TryCatch;
import org.pragmatica.kakapo.tree.WhileLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.kakapo.grammar.Expression.absent;
import static org.pragmatica.kakapo.grammar.Expression.and;
import static org.pragmatica.kakapo.grammar.Expression.charClass;
import static org.pragmatica.kakapo.grammar.Expression.choice;
import static org.pragmatica.kakapo.grammar.Expression.dictionary;
import static org.pragmatica.kakapo.grammar.Expression.endOfInput;
import static org.pragmatica.kakapo.grammar.Expression.literal;
import static org.pragmatica.kakapo.grammar.Expression.noneOf;
import static org.pragmatica.kakapo.grammar.Expression.not;
import static org.pragmatica.kakapo.grammar.Expression.nothing;
import static org.pragmatica.kakapo.grammar.Expression.oneOrMore;
import static org.pragmatica.kakapo.grammar.Expression.optional;
import static org.pragmatica.kakapo.grammar.Expression.ref;
import static org.pragmatica.kakapo.grammar.Expression.repeat;
import static org.pragmatica.kakapo.grammar.Expression.seq;
import static org.pragmatica.kakapo.grammar.Expression.token;
import static org.pragmatica.kakapo.grammar.Expression.zeroOrMore;
import static org.pragmatica.kakapo.grammar.Rule.rule;

/**
 * Grammar of MATLAB source files, built bottom-up: whitespace and tokens,
 * expressions, statements, blocks and finally the file.
 *
 * <p>Every byte of the input ends up in a leaf or a text slot of the tree, so
 * whitespace is matched explicitly everywhere. Two whitespace flavours exist:
 * {@code Ows}/{@code Ws} may span lines and separate constructs, while
 * {@code InlineOws} keeps an expression on one physical line unless a
 * {@code ...} continuation is used.
 */
public final class MatlabGrammar {
    public static final String START_RULE = "File";

    public static final int MAX_IDENTIFIER_LENGTH = 63;

    public static final List<String> KEYWORDS = List.of(
        "arguments", "break", "case", "catch", "classdef", "continue", "else", "elseif", "end", "for",
        "function", "global", "if", "methods", "otherwise", "parfor", "persistent", "properties", "return",
        "spmd", "switch", "try", "while"
    );

    public static final List<String> OPERATORS = List.of(
        "+", "-", "*", ".*", "/", "./", "^", ".^", "\\", "==", "~=", ">", ">=", "<", "<=",
        "&", "&&", "|", "||", ":"
    );

    private static final Expression IDENT_CHAR = charClass("A-Za-z0-9_");
    private static final Expression LETTER = charClass("A-Za-z");
    private static final Expression DIGIT = charClass("0-9");
    private static final Expression BLANK = charClass(" \t");
    private static final Expression NEWLINE = seq(optional(literal("\r")), literal("\n"));
    private static final Expression BLOCK_COMMENT_END = seq(zeroOrMore(BLANK),
                                                            literal("%}"),
                                                            zeroOrMore(BLANK),
                                                            and(choice(NEWLINE, endOfInput())));

    private MatlabGrammar() {
    }

    public static Grammar create() {
        var rules = new ArrayList<Rule>();
        rules.addAll(whitespace());
        rules.addAll(tokens());
        rules.addAll(expressions());
        rules.addAll(statements());
        rules.addAll(blocks());
        rules.add(rule("File", seq(ref("Gap"), ref("Code"), ref("Gap")),
                       parts -> new File(parts.text(0), parts.node(1, Code.class), parts.text(2))));
        return Grammar.of(rules, START_RULE);
    }

    // === Whitespace ===

    private static List<Rule> whitespace() {
        return List.of(
            rule("Continuation", seq(literal("..."), zeroOrMore(noneOf("\n")), optional(literal("\n")))),
            rule("Ws", token(oneOrMore(choice(ref("Continuation"), charClass(" \t\r\n"))))),
            rule("Ows", token(zeroOrMore(choice(ref("Continuation"), charClass(" \t\r\n"))))),
            rule("InlineOws", token(zeroOrMore(choice(ref("Continuation"), BLANK)))),
            rule("Blanks", token(oneOrMore(BLANK))),
            rule("HWs", token(zeroOrMore(BLANK))),
            // Whitespace between constructs, which may also hold empty statements such as ";;"
            rule("Gap", token(ref("Ows"), zeroOrMore(charClass(";,"), ref("Ows")))),
            rule("LineEnd", seq(zeroOrMore(BLANK),
                                choice(seq(optional(literal("\r")), literal("\n")),
                                       and(literal("%")),
                                       endOfInput())))
        );
    }

    // === Tokens ===

    private static List<Rule> tokens() {
        return List.of(
            rule("Keyword", seq(dictionary(KEYWORDS.toArray(String[]::new)), not(IDENT_CHAR))),
            rule("IdentifierPart", choice(IDENT_CHAR, seq(literal("."), and(LETTER)))),
            rule("Identifier", seq(not(ref("Keyword")),
                                   token(LETTER,
                                         repeat(ref("IdentifierPart"), 0, MAX_IDENTIFIER_LENGTH - 1),
                                         not(ref("IdentifierPart"))))),
            rule("Number", token(choice(seq(oneOrMore(DIGIT),
                                            optional(literal("."), not(charClass("*/\\\\^'")), zeroOrMore(DIGIT))),
                                        seq(literal("."), oneOrMore(DIGIT))),
                                 optional(charClass("eEdD"), optional(charClass("+-")), oneOrMore(DIGIT)),
                                 optional(charClass("ij")),
                                 not(IDENT_CHAR)),
                 parts -> parts.leaf(0)),
            rule("StringLiteral", token(choice(seq(literal("'"),
                                                   zeroOrMore(choice(literal("''"), noneOf("'\r\n"))),
                                                   literal("'")),
                                               seq(literal("\""),
                                                   zeroOrMore(choice(literal("\"\""), noneOf("\"\r\n"))),
                                                   literal("\"")))),
                 parts -> parts.leaf(0)),
            rule("Comment", choice(ref("BlockComment"), seq(token(literal("%")), token(zeroOrMore(noneOf("\r\n"))))),
                 parts -> new Comment(parts.text(0), parts.text(1))),
            // "%{" and "%}" each alone on their line; the lines between are kept verbatim
            rule("BlockComment", seq(token(literal("%{")),
                                     token(zeroOrMore(BLANK),
                                           NEWLINE,
                                           zeroOrMore(not(BLOCK_COMMENT_END), zeroOrMore(noneOf("\r\n")), NEWLINE),
                                           BLOCK_COMMENT_END))),
            rule("EndAtom", seq(token(literal("end")), not(IDENT_CHAR)), parts -> parts.leaf(0)),
            rule("Colon", token(literal(":")), parts -> parts.leaf(0)),
            rule("Tilde", token(literal("~")), parts -> parts.leaf(0)),
            rule("ControlKeyword", seq(token(dictionary("return", "break", "continue")), not(IDENT_CHAR)),
                 parts -> parts.leaf(0))
        );
    }

    // === Expressions ===

    private static List<Rule> expressions() {
        return List.of(
            rule("Expression", choice(ref("Operation"), ref("Operand"))),
            rule("Operation", seq(ref("Operand"), oneOrMore(ref("OperatorDelimiter"), ref("Operand"))),
                 MatlabGrammar::operation),
            rule("OperatorDelimiter", token(ref("InlineOws"), ref("Operator"), ref("InlineOws"))),
            rule("Operator", dictionary(OPERATORS.toArray(String[]::new))),
            rule("Operand", choice(ref("PrefixOperation"), ref("PostfixOperation"), ref("Atom"))),
            rule("PrefixOperation", seq(token(charClass("-~")), ref("Operand")),
                 parts -> new PrefixOperation(parts.leaf(0), parts.node(1))),
            rule("PostfixOperation", seq(ref("Atom"), token(choice(literal(".'"), literal("'")))),
                 parts -> new PostfixOperation(parts.node(0), parts.leaf(1))),
            rule("Atom", choice(ref("ParenthesizedExpression"),
                                ref("AnonymousFunction"),
                                ref("Array"),
                                ref("Number"),
                                ref("StringLiteral"),
                                ref("Call"),
                                ref("EndAtom"))),
            rule("ParenthesizedExpression", bracketed("(", ")", "InlineOws", "Expression", "InlineOws"),
                 MatlabGrammar::parenthesized),
            rule("AnonymousFunction", seq(token(literal("@")),
                                          ref("InlineOws"),
                                          choice(ref("ArgumentsList"), absent()),
                                          ref("InlineOws"),
                                          ref("Expression")),
                 parts -> new AnonymousFunction(parts.text(0),
                                                parts.text(1),
                                                parts.optional(2, ArgumentsList.class),
                                                parts.text(3),
                                                parts.node(4))),
            // Calls and argument lists
            rule("Call", seq(ref("Identifier"), zeroOrMore(choice(ref("ArgumentsList"), ref("FieldSelector")))),
                 MatlabGrammar::call),
            rule("FieldSelector", token(literal("."), ref("Identifier"))),
            rule("ArgumentsList", choice(bracketed("(", ")", "InlineOws", "ArgumentElements", "InlineOws"),
                                         bracketed("{", "}", "InlineOws", "ArgumentElements", "InlineOws")),
                 parts -> new ArgumentsList(parenthesized(parts))),
            rule("ArgumentElements", optional(ref("ArgumentElement"),
                                              zeroOrMore(ref("ArgumentDelimiter"), ref("ArgumentElement"))),
                 MatlabGrammar::delimitedList),
            rule("ArgumentElement", choice(ref("NameValue"), ref("Expression"), ref("Colon"))),
            rule("ArgumentDelimiter", token(ref("InlineOws"), literal(","), ref("InlineOws"))),
            rule("NameValue", seq(ref("Call"), ref("NameValueDelimiter"), ref("Expression")),
                 MatlabGrammar::operation),
            rule("NameValueDelimiter", token(ref("InlineOws"), literal("="), not(literal("=")), ref("InlineOws"))),
            // Arrays and cell arrays
            rule("Array", choice(bracketed("[", "]", "Ows", "ArrayElements", "ArrayTail"),
                                 bracketed("{", "}", "Ows", "ArrayElements", "ArrayTail")),
                 parts -> new Array(parenthesized(parts))),
            rule("ArrayElements", optional(ref("ArrayElement"),
                                           zeroOrMore(ref("ArrayDelimiter"), ref("ArrayElement"))),
                 MatlabGrammar::delimitedList),
            rule("ArrayElement", choice(ref("ArrayOperation"), ref("Operand"))),
            rule("ArrayOperation", seq(ref("Operand"), oneOrMore(ref("ArrayOperatorDelimiter"), ref("Operand"))),
                 MatlabGrammar::operation),
            // Inside brackets "a -b" is two elements, while "a - b" and "a-b" are one
            rule("ArrayOperatorDelimiter", seq(not(ref("Blanks"), charClass("+-"), not(BLANK)),
                                               ref("OperatorDelimiter"))),
            rule("ArrayDelimiter", choice(token(ref("Ows"), charClass(",;"), ref("Ows")), ref("Ws"))),
            rule("ArrayTail", token(ref("Ows"), optional(charClass(",;"), ref("Ows"))))
        );
    }

    // === Statements ===

    private static List<Rule> statements() {
        return List.of(
            rule("OutputArguments", seq(ref("OutputTarget"),
                                        ref("InlineOws"),
                                        token(literal("="), not(literal("="))),
                                        ref("InlineOws")),
                 parts -> new OutputArguments(parenthesized(parts), parts.text(5), parts.text(6), parts.text(7))),
            rule("OutputTarget", choice(bracketed("[", "]", "InlineOws", "OutputList", "InlineOws"),
                                        seq(nothing(), nothing(), ref("BareOutput"), nothing(), nothing()))),
            rule("OutputList", seq(ref("OutputElement"), zeroOrMore(ref("OutputDelimiter"), ref("OutputElement"))),
                 MatlabGrammar::delimitedList),
            rule("OutputDelimiter", choice(token(ref("InlineOws"), literal(","), ref("InlineOws")), ref("Blanks"))),
            rule("OutputElement", choice(ref("Tilde"), ref("Call"))),
            rule("BareOutput", ref("Call"), parts -> DelimitedList.single(parts.node(0))),
            rule("Statement", seq(choice(ref("OutputArguments"), absent()), ref("StatementBody"), ref("StatementEnd")),
                 parts -> new Statement(parts.optional(0, OutputArguments.class),
                                        parts.node(1),
                                        parts.text(2),
                                        parts.text(3))),
            rule("StatementBody", choice(ref("ControlKeyword"), seq(not(ref("Keyword")), ref("Expression")))),
            rule("StatementEnd", choice(seq(ref("HWs"), token(charClass(";,"))),
                                        seq(and(ref("LineEnd")), nothing(), nothing()))),
            rule("Command", seq(ref("CommandName"), oneOrMore(ref("Blanks"), ref("CommandWord")), ref("StatementEnd")),
                 MatlabGrammar::command),
            rule("CommandName", choice(seq(token(dictionary("global", "persistent")), not(IDENT_CHAR)),
                                       ref("Identifier"))),
            rule("CommandWord", token(ref("Identifier"), optional(literal(".*")))),
            rule("Code", sequenceOf("Construct"), MatlabGrammar::code),
            rule("Construct", choice(ref("Comment"),
                                     ref("Function"),
                                     ref("If"),
                                     ref("For"),
                                     ref("While"),
                                     ref("Switch"),
                                     ref("Try"),
                                     ref("Spmd"),
                                     ref("Classdef"),
                                     ref("Arguments"),
                                     ref("Statement"),
                                     ref("Command"))),
            // Body of a function without "end", which cannot hold nested functions
            rule("FlatCode", sequenceOf("FlatConstruct"), MatlabGrammar::code),
            rule("FlatConstruct", seq(not(keyword("function")), ref("Construct")))
        );
    }

    // === Blocks ===

    private static List<Rule> blocks() {
        return List.of(
            rule("Terminator", seq(ref("Gap"), keyword("end"), ref("BlockPunctuation"))),
            rule("BlockPunctuation", token(optional(charClass(";,")))),
            // if / elseif / else
            rule("If", seq(keyword("if"), ref("Ows"), ref("Statement"), ref("Gap"), ref("Code"),
                           zeroOrMore(ref("Gap"), ref("ElseIf")),
                           optional(ref("Gap"), ref("Else")),
                           ref("Terminator")),
                 MatlabGrammar::ifBlock),
            rule("ElseIf", seq(keyword("elseif"), ref("Ows"), ref("Statement"), ref("Gap"), ref("Code")),
                 parts -> new ElseIfClause(parts.leaf(0),
                                           parts.text(1),
                                           parts.node(2, Statement.class),
                                           parts.text(3),
                                           parts.node(4, Code.class))),
            rule("Else", seq(keyword("else"), nothing(), ref("Gap"), ref("Code")),
                 parts -> new ElseClause(parts.leaf(0), parts.text(1), parts.text(2), parts.node(3, Code.class))),
            // Loops
            rule("For", seq(choice(keyword("parfor"), keyword("for")),
                            ref("Ows"), ref("Statement"), ref("Gap"), ref("Code"), ref("Terminator")),
                 parts -> new ForLoop(parts.leaf(0),
                                      parts.text(1),
                                      parts.node(2, Statement.class),
                                      parts.text(3),
                                      parts.node(4, Code.class),
                                      terminator(parts, 5))),
            rule("While", seq(keyword("while"),
                              ref("Ows"), ref("Statement"), ref("Gap"), ref("Code"), ref("Terminator")),
                 parts -> new WhileLoop(parts.leaf(0),
                                        parts.text(1),
                                        parts.node(2, Statement.class),
                                        parts.text(3),
                                        parts.node(4, Code.class),
                                        terminator(parts, 5))),
            rule("Spmd", seq(keyword("spmd"), ref("Attributes"), ref("Gap"), ref("Code"), ref("Terminator")),
                 parts -> new Spmd(parts.leaf(0),
                                   parts.text(1),
                                   parts.optional(2, ArgumentsList.class),
                                   parts.text(3),
                                   parts.node(4, Code.class),
                                   terminator(parts, 5))),
            // switch / case / otherwise
            rule("Switch", seq(keyword("switch"),
                               ref("Ows"), ref("Statement"), ref("Gap"), ref("CaseList"), ref("Terminator")),
                 parts -> new Switch(parts.leaf(0),
                                     parts.text(1),
                                     parts.node(2, Statement.class),
                                     parts.text(3),
                                     parts.node(4, Code.class),
                                     terminator(parts, 5))),
            rule("CaseList", sequenceOf("CaseItem"), MatlabGrammar::code),
            rule("CaseItem", choice(ref("Comment"), ref("Case"), ref("Otherwise"))),
            rule("Case", seq(keyword("case"), ref("Ows"), ref("Statement"), ref("Gap"), ref("Code")),
                 parts -> new Case(parts.leaf(0),
                                   parts.text(1),
                                   Optional.of(parts.node(2, Statement.class)),
                                   parts.text(3),
                                   parts.node(4, Code.class))),
            rule("Otherwise", seq(keyword("otherwise"), nothing(), ref("Gap"), ref("Code")),
                 parts -> new Case(parts.leaf(0),
                                   parts.text(1),
                                   Optional.empty(),
                                   parts.text(2),
                                   parts.node(3, Code.class))),
            // try / catch
            rule("Try", seq(keyword("try"), nothing(), ref("Gap"), ref("Code"),
                            choice(seq(ref("Gap"), ref("Catch")), seq(nothing(), absent())),
                            ref("Terminator")),
                 parts -> new TryCatch(parts.leaf(0),
                                       parts.text(1),
                                       parts.text(2),
                                       parts.node(3, Code.class),
                                       parts.text(4),
                                       parts.optional(5, CatchClause.class),
                                       terminator(parts, 6))),
            rule("Catch", seq(keyword("catch"),
                              choice(seq(ref("Blanks"),
                                         ref("CatchVariable"),
                                         and(ref("HWs"), choice(ref("LineEnd"), charClass(";,")))),
                                     seq(nothing(), absent())),
                              ref("Gap"),
                              ref("Code")),
                 parts -> new CatchClause(parts.leaf(0),
                                          parts.text(1),
                                          parts.optional(2, Leaf.class),
                                          parts.text(3),
                                          parts.node(4, Code.class))),
            rule("CatchVariable", ref("Identifier"), parts -> parts.leaf(0)),
            // Functions, with or without "end"
            rule("Function", choice(ref("FunctionWithEnd"), ref("FunctionWithoutEnd"))),
            rule("FunctionWithEnd", seq(keyword("function"),
                                        ref("Ows"), ref("FunctionHead"), ref("Gap"), ref("Code"),
                                        ref("Terminator")),
                 MatlabGrammar::function),
            rule("FunctionWithoutEnd", seq(keyword("function"),
                                           ref("Ows"), ref("FunctionHead"), ref("Gap"), ref("FlatCode"),
                                           nothing(), nothing(), nothing()),
                 MatlabGrammar::function),
            rule("FunctionHead", seq(choice(ref("OutputArguments"), absent()), ref("Call"), nothing(), nothing()),
                 parts -> new Statement(parts.optional(0, OutputArguments.class),
                                        parts.node(1, Call.class),
                                        parts.text(2),
                                        parts.text(3))),
            // Class definitions
            rule("Classdef", seq(keyword("classdef"),
                                 ref("Ows"), ref("Statement"), ref("Gap"), ref("ClassCode"), ref("Terminator")),
                 parts -> new Classdef(parts.leaf(0),
                                       parts.text(1),
                                       parts.node(2, Statement.class),
                                       parts.text(3),
                                       parts.node(4, Code.class),
                                       terminator(parts, 5))),
            rule("ClassCode", sequenceOf("ClassMember"), MatlabGrammar::code),
            rule("ClassMember", choice(ref("Comment"),
                                       ref("Methods"),
                                       ref("Properties"),
                                       ref("Statement"),
                                       ref("Command"))),
            rule("Methods", seq(keyword("methods"), ref("Attributes"), ref("Gap"), ref("Code"), ref("Terminator")),
                 parts -> new Methods(parts.leaf(0),
                                      parts.text(1),
                                      parts.optional(2, ArgumentsList.class),
                                      parts.text(3),
                                      parts.node(4, Code.class),
                                      terminator(parts, 5))),
            rule("Properties", seq(keyword("properties"), ref("Attributes"), ref("Gap"), ref("Code"),
                                   ref("Terminator")),
                 parts -> new Properties(parts.leaf(0),
                                         parts.text(1),
                                         parts.optional(2, ArgumentsList.class),
                                         parts.text(3),
                                         parts.node(4, Code.class),
                                         terminator(parts, 5))),
            // Argument validation
            rule("Arguments", seq(keyword("arguments"), ref("Attributes"), ref("Gap"), ref("ArgumentsCode"),
                                  ref("Terminator")),
                 parts -> new ArgumentsBlock(parts.leaf(0),
                                             parts.text(1),
                                             parts.optional(2, ArgumentsList.class),
                                             parts.text(3),
                                             parts.node(4, Code.class),
                                             terminator(parts, 5))),
            rule("ArgumentsCode", sequenceOf("ArgumentMember"), MatlabGrammar::code),
            rule("ArgumentMember", choice(ref("Comment"), ref("ArgumentDeclaration"))),
            // Size, class and validators may come in any order; a default value comes last
            rule("ArgumentDeclaration", seq(ref("Call"),
                                            zeroOrMore(choice(seq(ref("InlineOws"), ref("ArgumentsList")),
                                                              seq(ref("Blanks"), ref("ArgumentClass")))),
                                            optional(ref("DefaultValue"), ref("Expression")),
                                            ref("StatementEnd")),
                 MatlabGrammar::argumentDeclaration),
            rule("ArgumentClass", ref("Identifier"), parts -> parts.leaf(0)),
            rule("DefaultValue", token(ref("InlineOws"), literal("="), not(literal("=")), ref("InlineOws"))),
            rule("Attributes", choice(seq(ref("InlineOws"), ref("ArgumentsList")), seq(nothing(), absent())))
        );
    }

    // === Expression helpers ===

    /**
     * A whole word, not followed by an identifier character. Contributes the word.
     */
    private static Expression keyword(String word) {
        return seq(token(literal(word)), not(IDENT_CHAR));
    }

    /**
     * Five parts: opening bracket, space, content, space, closing bracket.
     */
    private static Expression bracketed(String open, String close, String leading, String content, String trailing) {
        return seq(token(literal(open)), ref(leading), ref(content), ref(trailing), token(literal(close)));
    }

    /**
     * Zero or more constructs with the whitespace between them.
     */
    private static Expression sequenceOf(String construct) {
        return optional(ref(construct), zeroOrMore(ref("Gap"), ref(construct)));
    }

    // === Node actions ===

    private static Node delimitedList(Parts parts) {
        return DelimitedList.of(parts.nodes(0, parts.size(), Node.class), parts.texts(1, parts.size()));
    }

    private static Node operation(Parts parts) {
        return new Operation(DelimitedList.of(parts.nodes(0, parts.size(), Node.class),
                                              parts.texts(1, parts.size())));
    }

    private static Node code(Parts parts) {
        return Code.of(parts.nodes(0, parts.size(), Node.class), parts.texts(1, parts.size()));
    }

    private static Parenthesized parenthesized(Parts parts) {
        return new Parenthesized(parts.text(0), parts.text(1), parts.node(2), parts.text(3), parts.text(4));
    }

    private static Node call(Parts parts) {
        var selectors = new ArrayList<Node>();
        for (int i = 1; i < parts.size(); i++) {
            selectors.add(parts.get(i) instanceof String
                          ? parts.leaf(i)
                          : parts.node(i, ArgumentsList.class));
        }
        return new Call(parts.leaf(0), selectors);
    }

    private static Node command(Parts parts) {
        int end = parts.size() - 2;
        return new Command(parts.leaves(0, end), parts.texts(1, end), parts.text(end), parts.text(end + 1));
    }

    private static Node argumentDeclaration(Parts parts) {
        int end = parts.size() - 2;
        return new ArgumentDeclaration(parts.nodes(0, end, Node.class),
                                       parts.texts(1, end),
                                       parts.text(end),
                                       parts.text(end + 1));
    }

    private static Node ifBlock(Parts parts) {
        int end = parts.size() - 3;
        var gaps = parts.texts(5, end);
        var clauses = parts.nodes(6, end, Clause.class);
        return new If(parts.leaf(0),
                      parts.text(1),
                      parts.node(2, Statement.class),
                      parts.text(3),
                      parts.node(4, Code.class),
                      gaps,
                      clauses,
                      terminator(parts, end));
    }

    private static Node function(Parts parts) {
        return new Function(parts.leaf(0),
                            parts.text(1),
                            parts.node(2, Statement.class),
                            parts.text(3),
                            parts.node(4, Code.class),
                            terminator(parts, 5));
    }

    private static Terminator terminator(Parts parts, int from) {
        return new Terminator(parts.text(from), parts.leaf(from + 1), parts.text(from + 2));
    }
}
