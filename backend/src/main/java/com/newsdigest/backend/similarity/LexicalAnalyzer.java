package com.newsdigest.backend.similarity;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.shingle.ShingleFilter;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Lucene token streams for the lexical similarity strategies: standard tokenization, lowercasing
 * and English stop word removal, optionally with word bigrams.
 */
public final class LexicalAnalyzer {

    private static final String TOKEN_STREAM_FIELD = "text";
    private static final String FILLER_TOKEN = "_";

    private LexicalAnalyzer() {
    }

    public static List<String> terms(String text) {
        return analyze(text, false);
    }

    public static Set<String> termSet(String text) {
        return new LinkedHashSet<>(terms(text));
    }

    /**
     * Unigrams followed in stream order by the bigrams of adjacent words. A bigram never spans a
     * removed stop word.
     */
    public static List<String> termsWithBigrams(String text) {
        return analyze(text, true);
    }

    private static List<String> analyze(String text, boolean bigrams) {
        List<String> terms = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return terms;
        }
        try (StandardAnalyzer analyzer = new StandardAnalyzer(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
                TokenStream tokenStream = bigrams
                        ? shingles(analyzer.tokenStream(TOKEN_STREAM_FIELD, text))
                        : analyzer.tokenStream(TOKEN_STREAM_FIELD, text)) {
            CharTermAttribute termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                String term = termAttribute.toString();
                if (!term.contains(FILLER_TOKEN)) {
                    terms.add(term);
                }
            }
            tokenStream.end();
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to tokenize text for lexical similarity", ioException);
        }
        return terms;
    }

    private static TokenStream shingles(TokenStream input) {
        ShingleFilter shingleFilter = new ShingleFilter(input, 2, 2);
        shingleFilter.setOutputUnigrams(true);
        shingleFilter.setFillerToken(FILLER_TOKEN);
        return shingleFilter;
    }
}
