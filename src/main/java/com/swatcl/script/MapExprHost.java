package com.swatcl.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.swatcl.script.parser.Coercion;
import com.swatcl.script.parser.ErrorCode;
import com.swatcl.script.parser.EvalException;
import com.swatcl.script.parser.Lexer;
import com.swatcl.script.parser.Token;
import com.swatcl.script.parser.TokenType;
import com.swatcl.script.parser.Value;

/**
 * Minimal in-memory host: variables live in a map and the only command is
 * {@code expr <words...>}. The command's words get Tcl substitution (braces
 * stay literal, quoted and bare words see variables, nested commands and
 * backslashes) and are joined by spaces before re-entering the engine.
 * Used by the command-line driver and by tests.
 */
public class MapExprHost implements ExprHost {

    private final Map<String, String> variables = new LinkedHashMap<>();
    private final SwatclExpr engine;

    public MapExprHost() {
        this.engine = new SwatclExpr(this);
    }

    public MapExprHost(Map<String, String> initial) {
        this();
        if (initial != null) variables.putAll(initial);
    }

    /** The engine bound to this host. */
    public SwatclExpr engine() {
        return engine;
    }

    public Value evaluate(String expression) {
        return engine.evaluate(expression);
    }

    public void setVariable(String name, String value) {
        variables.put(name, value);
    }

    public void unsetVariable(String name) {
        variables.remove(name);
    }

    public Map<String, String> variables() {
        return variables;
    }

    @Override
    public String getVariable(String name) {
        return variables.get(name);
    }

    @Override
    public String evaluateCommand(String script) {
        Lexer lexer = Lexer.statement(script);
        List<String> words = new ArrayList<>();
        StringBuilder word = null;
        int wordEnd = -1;
        boolean ended = false;

        while (lexer.hasNext()) {
            Token tok = lexer.next();
            if (tok.type == TokenType.EOF) break;
            if (tok.type == TokenType.ERROR) {
                throw new EvalException(ErrorCode.LEXER, tok.lexeme);
            }
            if (tok.type == TokenType.EOL) {
                if (word != null) words.add(word.toString());
                word = null;
                ended = !words.isEmpty();
                continue;
            }
            if (ended) {
                throw new EvalException(ErrorCode.COMMAND, "only one command allowed: " + script);
            }
            // tokens with no separator between them form one word
            boolean continues = word != null && tok.offset == wordEnd;
            if (word != null && !continues) {
                words.add(word.toString());
                word = null;
            }
            if (word == null) word = new StringBuilder();
            word.append(substitute(tok, continues));
            wordEnd = tok.end();
        }
        if (word != null) words.add(word.toString());

        if (words.isEmpty()) return "";
        String name = words.get(0);
        if (!"expr".equals(name)) {
            throw new EvalException(ErrorCode.COMMAND, "invalid command name \"" + name + "\"");
        }
        if (words.size() == 1) {
            throw new EvalException(ErrorCode.COMMAND, "wrong # args: should be \"expr arg ?arg ...?\"");
        }
        return engine.evaluate(String.join(" ", words.subList(1, words.size()))).toString();
    }

    /** Text one token contributes to its word. Braces quote only at the start of a word. */
    private String substitute(Token tok, boolean midWord) {
        switch (tok.type) {
            case QUOTE:
                return Coercion.evalString(tok.contents());
            case BRACE:
                return midWord ? tok.lexeme : tok.contents();
            case VARIABLE:
                return variable(tok.contents());
            case COMMAND:
                return evaluateCommand(tok.contents());
            default:
                return Coercion.evalString(tok.lexeme);
        }
    }

    private String variable(String name) {
        String value = variables.get(name);
        if (value == null) {
            throw new EvalException(ErrorCode.VARIABLE, "can't read \"" + name + "\": no such variable");
        }
        return value;
    }
}
