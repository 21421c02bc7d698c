package com.bookreader.nlp.text;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tartarus.snowball.ext.RussianStemmer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lucene-backed tokenizer and Snowball stemmer for Russian prose.
 *
 * <p>The analyzer is thread-safe; one instance is shared by the segmenter, the lexicon and
 * every extractor. Text is folded from {@code ё} to {@code е} before analysis, which keeps
 * character offsets intact.</p>
 */
@ApplicationScoped
public class RussianTextAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(RussianTextAnalyzer.class);
    private static final String FIELD = "text";

    private final Analyzer analyzer;

    public RussianTextAnalyzer() {
        this.analyzer = new Analyzer() {
            @Override
            protected TokenStreamComponents createComponents(String fieldName) {
                StandardTokenizer source = new StandardTokenizer();
                TokenStream result = new LowerCaseFilter(source);
                result = new SnowballFilter(result, new RussianStemmer());
                return new TokenStreamComponents(source, result);
            }
        };
    }

    /**
     * Tokenizes text into word tokens.
     *
     * @param text       text to analyze
     * @param baseOffset chapter offset of {@code text}; added to every token offset
     * @return tokens in text order
     */
    @NotNull
    public List<Token> tokenize(@NotNull String text, int baseOffset) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        String folded = fold(text);
        List<Token> tokens = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD, folded)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            OffsetAttribute offset = stream.addAttribute(OffsetAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                int start = offset.startOffset();
                int end = offset.endOffset();
                String surface = text.substring(start, end);
                tokens.add(new Token(
                    surface,
                    folded.substring(start, end).toLowerCase(Locale.ROOT),
                    term.toString(),
                    baseOffset + start,
                    baseOffset + end
                ));
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Tokenization failed for text of length " + text.length(), e);
        }
        return tokens;
    }

    @NotNull
    public List<Token> tokenize(@NotNull String text) {
        return tokenize(text, 0);
    }

    /**
     * Stems a single word, returning the lowercase word itself when the analyzer drops it.
     */
    @NotNull
    public String stem(@NotNull String word) {
        List<Token> tokens = tokenize(word, 0);
        if (tokens.isEmpty()) {
            return fold(word).toLowerCase(Locale.ROOT).trim();
        }
        return tokens.get(0).stem();
    }

    static String fold(String text) {
        return text.replace('ё', 'е').replace('Ё', 'Е');
    }

    @PreDestroy
    void close() {
        LOG.debug("Closing Russian analyzer");
        analyzer.close();
    }
}
