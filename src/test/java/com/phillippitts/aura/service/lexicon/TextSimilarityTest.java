package com.phillippitts.aura.service.lexicon;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextSimilarityTest {

    @Test
    void normalizeLowercasesTrimsAndCollapsesWhitespace() {
        assertThat(TextSimilarity.normalize("  Slapped   CHEEK\tappearance ")).isEqualTo("slapped cheek appearance");
        assertThat(TextSimilarity.normalize(null)).isEmpty();
    }

    @Test
    void levenshteinCountsEdits() {
        assertThat(TextSimilarity.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(TextSimilarity.levenshtein("", "abc")).isEqualTo(3);
        assertThat(TextSimilarity.levenshtein("same", "same")).isZero();
    }

    @Test
    void ratioIsOneForIdenticalAndScalesWithDistance() {
        assertThat(TextSimilarity.ratio("stiff neck", "stiff neck")).isEqualTo(1.0);
        assertThat(TextSimilarity.ratio("", "")).isEqualTo(1.0);
        assertThat(TextSimilarity.ratio("abcd", "abce")).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void similarityFindsPhraseInsideLongerText() {
        assertThat(TextSimilarity.similarity("slapped cheek appearance", "slapped cheek")).isEqualTo(1.0);
    }

    @Test
    void similarityToleratesSmallTypos() {
        assertThat(TextSimilarity.similarity("barkng cough at night", "barking cough")).isGreaterThan(0.8);
    }

    @Test
    void similarityIsLowForUnrelatedText() {
        assertThat(TextSimilarity.similarity("mild", "petechial rash")).isLessThan(0.5);
    }
}
