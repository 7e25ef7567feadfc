package com.smartexam.compiler.lexer;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy view of the tokens of one source text. Every call to {@link #iterator()}
 * starts a fresh {@link DslLexer}, so the sequence can be replayed from scratch.
 * Iteration ends after the {@link TokenKind#EOF} token.
 */
public final class TokenStream implements Iterable<Token> {
    private final String source;

    public TokenStream(String source) {
        this.source = source == null ? "" : source;
    }

    @Override
    public Iterator<Token> iterator() {
        DslLexer lexer = new DslLexer(source);
        return new Iterator<>() {
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public Token next() {
                if (done) throw new NoSuchElementException("Token stream exhausted");
                Token t = lexer.nextToken();
                if (t.kind() == TokenKind.EOF) done = true;
                return t;
            }
        };
    }
}
