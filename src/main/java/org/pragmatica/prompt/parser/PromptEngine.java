package org.pragmatica.prompt.parser;

import org.pragmatica.prompt.error.ParseError;
import org.pragmatica.prompt.error.ParsingException;
import org.pragmatica.prompt.transform.Flattener;
import org.pragmatica.prompt.tree.PromptNode;
import org.pragmatica.prompt.tree.PromptNode.Attention;
import org.pragmatica.prompt.tree.PromptNode.Blend;
import org.pragmatica.prompt.tree.PromptNode.Conjunction;
import org.pragmatica.prompt.tree.PromptNode.CrossAttentionControlSubstitute;
import org.pragmatica.prompt.tree.PromptNode.FlattenedPrompt;
import org.pragmatica.prompt.tree.PromptNode.Fragment;
import org.pragmatica.prompt.tree.PromptNode.Prompt;
import org.pragmatica.prompt.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser for the weighted prompt language.
 *
 * <p>Top level, first match wins:
 * <pre>
 * conjunction  <- '(' quotedPrompt (',' quotedPrompt)* ')' '.and' '(' numbers? ')' EOI
 *               / (blend)* prompt?
 * blend        <- '(' quotedPrompt (',' quotedPrompt)* ')' '.blend' '(' numbers ')'
 * prompt       <- (substitute / attention / quotedFragment / unquotedFragment)+ EOI
 * substitute   <- (emptyString / quotedFragment / parenFragment / unquotedFragment) '.swap' parenFragment
 * attention    <- head '(' (quotedFragment / group / attention / word)* ')'
 *               / ('+'+ / '-'+) word
 * </pre>
 *
 * <p>Unquoted fragments accept any run of non-whitespace characters, so text that fits no
 * structured rule (unbalanced parentheses, dangling {@code .swap}) is kept as literal text.
 */
public final class PromptEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(PromptEngine.class);

    private final ParserConfig config;

    private PromptEngine(ParserConfig config) {
        this.config = config;
    }

    public static PromptEngine create(ParserConfig config) {
        return new PromptEngine(config);
    }

    @Override
    public Conjunction parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return new Conjunction(List.of(new FlattenedPrompt(List.of(new Fragment("")))), List.of(1.0));
        }
        return Flattener.flatten(parseRaw(text));
    }

    @Override
    public Conjunction parseRaw(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return Conjunction.of(new Prompt(List.of(new Fragment(""))));
        }
        log.debug("Parsing '{}'", text);
        var root = parseConjunction(ParsingContext.create(text, config));
        log.debug("'{}' parsed to {}", text, root);
        return root;
    }

    public ParserConfig config() {
        return config;
    }

    // === Conjunctions and Blends ===

    private Conjunction parseConjunction(ParsingContext ctx) {
        if (parseExplicitConjunction(ctx) instanceof ParseResult.Success<Conjunction> explicit) {
            return explicit.value();
        }
        return parseImplicitConjunction(ctx);
    }

    private ParseResult<Conjunction> parseExplicitConjunction(ParsingContext ctx) {
        var start = ctx.location();
        var terms = parseQuotedPromptList(ctx);
        if (!(terms instanceof ParseResult.Success<List<PromptNode>> prompts)) {
            return fail(ctx, start, "conjunction");
        }
        ctx.skipWhitespace();
        if (!ctx.consume(".and")) {
            return fail(ctx, start, "'.and'");
        }
        ctx.skipWhitespace();
        if (!ctx.consume("(")) {
            return fail(ctx, start, "'('");
        }
        ctx.skipWhitespace();
        List<Double> weights = null;
        if (!ctx.at(')')) {
            if (!(parseNumberList(ctx) instanceof ParseResult.Success<List<Double>> numbers)) {
                return fail(ctx, start, "conjunction weights");
            }
            weights = numbers.value();
        }
        ctx.skipWhitespace();
        if (!ctx.consume(")")) {
            return fail(ctx, start, "')'");
        }
        ctx.skipWhitespace();
        if (!ctx.isAtEnd()) {
            return fail(ctx, start, "end of input");
        }
        var conjunction = weights == null
                          ? Conjunction.of(prompts.value())
                          : Conjunction.of(prompts.value(), weights);
        return succeed(ctx, conjunction);
    }

    private Conjunction parseImplicitConjunction(ParsingContext ctx) {
        var branches = new ArrayList<PromptNode>();
        while (true) {
            ctx.skipWhitespace();
            if (ctx.isAtEnd()) {
                break;
            }
            if (parseBlend(ctx) instanceof ParseResult.Success<Blend> blend) {
                branches.add(blend.value());
                continue;
            }
            branches.add(parsePrompt(ctx));
        }
        return Conjunction.of(branches);
    }

    private ParseResult<Blend> parseBlend(ParsingContext ctx) {
        var start = ctx.location();
        if (!(parseQuotedPromptList(ctx) instanceof ParseResult.Success<List<PromptNode>> prompts)) {
            return fail(ctx, start, "blend");
        }
        ctx.skipWhitespace();
        if (!ctx.consume(".blend")) {
            return fail(ctx, start, "'.blend'");
        }
        ctx.skipWhitespace();
        if (!ctx.consume("(")) {
            return fail(ctx, start, "'('");
        }
        ctx.skipWhitespace();
        if (!(parseNumberList(ctx) instanceof ParseResult.Success<List<Double>> weights)) {
            return fail(ctx, start, "blend weights");
        }
        ctx.skipWhitespace();
        if (!ctx.consume(")")) {
            return fail(ctx, start, "')'");
        }
        return succeed(ctx, new Blend(prompts.value(), weights.value()));
    }

    private ParseResult<List<PromptNode>> parseQuotedPromptList(ParsingContext ctx) {
        var start = ctx.location();
        ctx.skipWhitespace();
        if (!ctx.consume("(")) {
            return fail(ctx, start, "'('");
        }
        var prompts = new ArrayList<PromptNode>();
        do {
            ctx.skipWhitespace();
            if (!(parseQuotedPrompt(ctx) instanceof ParseResult.Success<Prompt> prompt)) {
                return fail(ctx, start, "quoted prompt");
            }
            prompts.add(prompt.value());
            ctx.skipWhitespace();
        } while (ctx.consume(","));
        if (!ctx.consume(")")) {
            return fail(ctx, start, "')'");
        }
        return succeed(ctx, prompts);
    }

    private ParseResult<Prompt> parseQuotedPrompt(ParsingContext ctx) {
        var start = ctx.location();
        if (!ctx.consume("\"")) {
            return fail(ctx, start, "'\"'");
        }
        var bodyStart = ctx.pos();
        while (!ctx.isAtEnd() && !ctx.at('"')) {
            if (ctx.at('\\') && ctx.remaining() > 1) {
                ctx.advance();
            }
            ctx.advance();
        }
        if (ctx.isAtEnd()) {
            return fail(ctx, start, "closing '\"'");
        }
        var body = ctx.substring(bodyStart, ctx.pos());
        ctx.advance();
        if (body.isBlank()) {
            return succeed(ctx, new Prompt(List.of(new Fragment(""))));
        }
        return succeed(ctx, parsePrompt(ctx.nested(body)));
    }

    private ParseResult<List<Double>> parseNumberList(ParsingContext ctx) {
        var start = ctx.location();
        var numbers = new ArrayList<Double>();
        do {
            ctx.skipWhitespace();
            if (!(parseNumber(ctx) instanceof ParseResult.Success<Double> number)) {
                return fail(ctx, start, "number");
            }
            numbers.add(number.value());
            ctx.skipWhitespace();
        } while (ctx.consume(","));
        return succeed(ctx, numbers);
    }

    /**
     * Signed real ({@code 0.5}, {@code -.5}, {@code 2.}) or unsigned integer.
     */
    private ParseResult<Double> parseNumber(ParsingContext ctx) {
        var start = ctx.location();
        var startPos = ctx.pos();
        if (ctx.at('+') || ctx.at('-')) {
            ctx.advance();
        }
        int whole = skipDigits(ctx);
        if (ctx.at('.')) {
            ctx.advance();
            int fraction = skipDigits(ctx);
            if (whole > 0 || fraction > 0) {
                return succeed(ctx, Double.parseDouble(ctx.substring(startPos, ctx.pos())));
            }
        }
        ctx.restoreLocation(start);
        if (skipDigits(ctx) > 0) {
            return succeed(ctx, Double.parseDouble(ctx.substring(startPos, ctx.pos())));
        }
        return fail(ctx, start, "number");
    }

    private static int skipDigits(ParsingContext ctx) {
        int count = 0;
        while (!ctx.isAtEnd() && isDigit(ctx.peek())) {
            ctx.advance();
            count++;
        }
        return count;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // === Prompts ===

    private Prompt parsePrompt(ParsingContext ctx) {
        var parts = new ArrayList<PromptNode>();
        while (true) {
            ctx.skipWhitespace();
            if (ctx.isAtEnd()) {
                break;
            }
            parts.addAll(parsePromptPart(ctx));
        }
        return new Prompt(parts);
    }

    private List<PromptNode> parsePromptPart(ParsingContext ctx) {
        if (parseSubstitute(ctx) instanceof ParseResult.Success<CrossAttentionControlSubstitute> substitute) {
            return List.of(substitute.value());
        }
        if (parseAttention(ctx) instanceof ParseResult.Success<Attention> attention) {
            return List.of(attention.value());
        }
        if (parseQuotedFragment(ctx) instanceof ParseResult.Success<List<PromptNode>> quoted) {
            return quoted.value();
        }
        return List.of(parseUnquotedFragment(ctx));
    }

    // === Cross-Attention Substitution ===

    private ParseResult<CrossAttentionControlSubstitute> parseSubstitute(ParsingContext ctx) {
        var start = ctx.location();
        var original = parseSwapOriginal(ctx);
        ctx.skipWhitespace();
        if (!ctx.consume(".swap")) {
            return fail(ctx, start, "'.swap'");
        }
        ctx.skipWhitespace();
        if (!(parseParenthesizedFragment(ctx) instanceof ParseResult.Success<List<PromptNode>> edited)) {
            return fail(ctx, start, "parenthesized fragment");
        }
        return succeed(ctx, new CrossAttentionControlSubstitute(original, edited.value()));
    }

    private List<PromptNode> parseSwapOriginal(ParsingContext ctx) {
        if (parseEmptyString(ctx) instanceof ParseResult.Success<List<PromptNode>> empty) {
            return empty.value();
        }
        if (parseQuotedFragment(ctx) instanceof ParseResult.Success<List<PromptNode>> quoted) {
            return quoted.value();
        }
        if (parseParenthesizedFragment(ctx) instanceof ParseResult.Success<List<PromptNode>> parenthesized) {
            return parenthesized.value();
        }
        return List.of(parseUnquotedFragment(ctx));
    }

    /**
     * {@code ""}, {@code ()} or {@code ("")}, whitespace allowed inside the parentheses.
     */
    private ParseResult<List<PromptNode>> parseEmptyString(ParsingContext ctx) {
        var start = ctx.location();
        if (ctx.consume("\"\"")) {
            return succeed(ctx, emptyFragment());
        }
        if (ctx.consume("(")) {
            ctx.skipWhitespace();
            ctx.consume("\"\"");
            ctx.skipWhitespace();
            if (ctx.consume(")")) {
                return succeed(ctx, emptyFragment());
            }
        }
        return fail(ctx, start, "empty string");
    }

    // === Fragments ===

    /**
     * Double-quoted text re-parsed as a phrase. Only {@code \"} is unescaped.
     */
    private ParseResult<List<PromptNode>> parseQuotedFragment(ParsingContext ctx) {
        var start = ctx.location();
        if (!ctx.consume("\"")) {
            return fail(ctx, start, "'\"'");
        }
        var body = new StringBuilder();
        while (!ctx.isAtEnd() && !ctx.at('"')) {
            char c = ctx.advance();
            if (c == '\\' && !ctx.isAtEnd()) {
                char escaped = ctx.advance();
                if (escaped != '"') {
                    body.append(c);
                }
                body.append(escaped);
            } else {
                body.append(c);
            }
        }
        if (ctx.isAtEnd()) {
            return fail(ctx, start, "closing '\"'");
        }
        ctx.advance();
        return succeed(ctx, parsePhrase(ctx, body.toString()));
    }

    /**
     * {@code ("quoted")}, or parentheses around text up to the first unescaped {@code )}. Does not nest.
     */
    private ParseResult<List<PromptNode>> parseParenthesizedFragment(ParsingContext ctx) {
        var start = ctx.location();
        if (!ctx.consume("(")) {
            return fail(ctx, start, "'('");
        }
        var bodyLocation = ctx.location();
        ctx.skipWhitespace();
        if (parseQuotedFragment(ctx) instanceof ParseResult.Success<List<PromptNode>> quoted) {
            ctx.skipWhitespace();
            if (ctx.consume(")")) {
                return succeed(ctx, quoted.value());
            }
        }
        ctx.restoreLocation(bodyLocation);
        var bodyStart = ctx.pos();
        while (!ctx.isAtEnd() && !ctx.at(')')) {
            if (ctx.at('\\') && ctx.remaining() > 1 && ctx.peek(1) == ')') {
                ctx.advance();
            }
            ctx.advance();
        }
        if (ctx.isAtEnd()) {
            return fail(ctx, start, "')'");
        }
        var body = ctx.substring(bodyStart, ctx.pos());
        ctx.advance();
        return succeed(ctx, parsePhrase(ctx, body));
    }

    /**
     * Run of non-whitespace characters ended by an unescaped quote. Always consumes at least one character:
     * a quote that opens no quoted fragment is taken as text.
     */
    private Fragment parseUnquotedFragment(ParsingContext ctx) {
        var startPos = ctx.pos();
        while (!ctx.isAtEnd() && !ctx.atWhitespace()) {
            if (ctx.at('"') && ctx.pos() > startPos) {
                break;
            }
            if (ctx.at('\\') && ctx.remaining() > 1 && ctx.peek(1) == '"') {
                ctx.advance();
            }
            ctx.advance();
        }
        return new Fragment(ctx.substring(startPos, ctx.pos()));
    }

    /**
     * Whitespace-separated attentions and plain words. Words keep every character, quotes included.
     */
    private List<PromptNode> parsePhrase(ParsingContext parent, String text) {
        if (text.isBlank()) {
            return emptyFragment();
        }
        var ctx = parent.nested(text);
        var nodes = new ArrayList<PromptNode>();
        while (true) {
            ctx.skipWhitespace();
            if (ctx.isAtEnd()) {
                break;
            }
            if (parseAttention(ctx) instanceof ParseResult.Success<Attention> attention) {
                nodes.add(attention.value());
                continue;
            }
            var startPos = ctx.pos();
            while (!ctx.isAtEnd() && !ctx.atWhitespace()) {
                ctx.advance();
            }
            nodes.add(new Fragment(ctx.substring(startPos, ctx.pos())));
        }
        return nodes;
    }

    private static List<PromptNode> emptyFragment() {
        return List.of(new Fragment(""));
    }

    // === Attention ===

    private ParseResult<Attention> parseAttention(ParsingContext ctx) {
        var withParens = parseAttentionWithParens(ctx);
        if (withParens.isSuccess()) {
            return withParens;
        }
        return parseAttentionWithoutParens(ctx);
    }

    private ParseResult<Attention> parseAttentionWithParens(ParsingContext ctx) {
        var start = ctx.location();
        if (!(parseAttentionHead(ctx) instanceof ParseResult.Success<Double> head)) {
            return fail(ctx, start, "attention head");
        }
        if (!ctx.at('(')) {
            return fail(ctx, start, "'('");
        }
        if (!(parseAttentionBody(ctx) instanceof ParseResult.Success<List<PromptNode>> body)) {
            return fail(ctx, start, "attention body");
        }
        return succeed(ctx, new Attention(head.value(), body.value()));
    }

    private ParseResult<Attention> parseAttentionWithoutParens(ParsingContext ctx) {
        var start = ctx.location();
        if (!(parseSignRun(ctx) instanceof ParseResult.Success<Double> weight)) {
            return fail(ctx, start, "'+' or '-'");
        }
        var word = parseAttentionWord(ctx);
        if (word.isEmpty()) {
            return fail(ctx, start, "word");
        }
        return succeed(ctx, new Attention(weight.value(), List.of(new Fragment(word))));
    }

    private ParseResult<Double> parseAttentionHead(ParsingContext ctx) {
        var number = parseNumber(ctx);
        if (number.isSuccess()) {
            return number;
        }
        return parseSignRun(ctx);
    }

    /**
     * Run of {@code k} identical signs, weighted {@code base^k}.
     */
    private ParseResult<Double> parseSignRun(ParsingContext ctx) {
        var start = ctx.location();
        if (!ctx.at('+') && !ctx.at('-')) {
            return fail(ctx, start, "'+' or '-'");
        }
        char sign = ctx.peek();
        int count = 0;
        while (ctx.at(sign)) {
            ctx.advance();
            count++;
        }
        var base = sign == '+'
                   ? config.attentionPlusBase()
                   : config.attentionMinusBase();
        return succeed(ctx, Math.pow(base, count));
    }

    /**
     * Parenthesized body of an attention. Plain nested parentheses group without changing the weight.
     * Results are cached per opening position, so an unclosed body is parsed once however many
     * alternatives reach it.
     */
    private ParseResult<List<PromptNode>> parseAttentionBody(ParsingContext ctx) {
        var startPos = ctx.pos();
        var cached = ctx.cachedBodyAt(startPos);
        if (cached != null) {
            if (cached instanceof ParseResult.Success<List<PromptNode>> success) {
                ctx.restoreLocation(success.endLocation());
            }
            return cached;
        }
        var result = parseAttentionBodyUncached(ctx);
        ctx.cacheBodyAt(startPos, result);
        return result;
    }

    private ParseResult<List<PromptNode>> parseAttentionBodyUncached(ParsingContext ctx) {
        var start = ctx.location();
        if (!ctx.consume("(")) {
            return fail(ctx, start, "'('");
        }
        if (!ctx.tryEnterNesting()) {
            if (ctx.groupCloses()) {
                throw new ParsingException(new ParseError.NestingTooDeep(start, ctx.config().maxNestingDepth()));
            }
            return fail(ctx, start, "')'");
        }
        try {
            var children = new ArrayList<PromptNode>();
            while (true) {
                ctx.skipWhitespace();
                if (ctx.isAtEnd()) {
                    return fail(ctx, start, "')'");
                }
                if (ctx.consume(")")) {
                    return succeed(ctx, children);
                }
                if (ctx.at('"') && parseQuotedFragment(ctx) instanceof ParseResult.Success<List<PromptNode>> quoted) {
                    children.addAll(quoted.value());
                    continue;
                }
                if (ctx.at('(')) {
                    if (!(parseAttentionBody(ctx) instanceof ParseResult.Success<List<PromptNode>> group)) {
                        return fail(ctx, start, "')'");
                    }
                    children.addAll(group.value());
                    continue;
                }
                if (parseAttentionWithParens(ctx) instanceof ParseResult.Success<Attention> nested) {
                    children.add(nested.value());
                    continue;
                }
                children.add(new Fragment(parseAttentionWord(ctx)));
            }
        } finally {
            ctx.exitNesting();
        }
    }

    /**
     * Characters other than whitespace and parentheses; {@code \(} and {@code \)} are kept verbatim.
     */
    private static String parseAttentionWord(ParsingContext ctx) {
        var startPos = ctx.pos();
        while (!ctx.isAtEnd() && !ctx.atWhitespace() && !ctx.at('(') && !ctx.at(')')) {
            if (ctx.at('\\') && ctx.remaining() > 1 && (ctx.peek(1) == '(' || ctx.peek(1) == ')')) {
                ctx.advance();
            }
            ctx.advance();
        }
        return ctx.substring(startPos, ctx.pos());
    }

    // === Result Helpers ===

    private static <T> ParseResult<T> succeed(ParsingContext ctx, T value) {
        return ParseResult.Success.of(value, ctx.location());
    }

    private static <T> ParseResult<T> fail(ParsingContext ctx, SourceLocation start, String expected) {
        var failure = ParseResult.Failure.<T>at(ctx.location(), expected);
        ctx.restoreLocation(start);
        return failure;
    }
}
