package com.lazytext.recipe;

import com.lazytext.config.CorpusConfig;
import com.lazytext.storage.ParallelTokenStore;
import com.lazytext.vocab.IndexedVocabulary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BilingualRecipeTest {

    @TempDir
    Path tempDir;

    private Path sourceFile;
    private Path targetFile;

    @BeforeEach
    void setUp() throws IOException {
        sourceFile = tempDir.resolve("train.de");
        targetFile = tempDir.resolve("train.en");
        Files.write(sourceFile, List.of("Ein Hund", "Das Haus ist alt", "Hallo"), StandardCharsets.UTF_8);
        Files.write(targetFile, List.of("A dog", "The house", "Hello there my friend"), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("源端与目标端逐行对齐并各自预处理")
    void testMakeCorpus() throws IOException {
        BilingualRecipe recipe = BilingualRecipe.wordLevel("de", "en", true, true, false);
        IndexedVocabulary sourceVocabulary = recipe.makeSourceVocabulary(List.of(sourceFile));
        IndexedVocabulary targetVocabulary = recipe.makeTargetVocabulary(List.of(targetFile));

        try (ParallelTokenStore store = recipe.makeCorpus(List.of(sourceFile), List.of(targetFile),
            sourceVocabulary, targetVocabulary, config("all"))) {
            assertEquals(3, store.size());
            assertEquals(List.of("das haus ist alt", "the house"), store.strings(1));
        }
    }

    @Test
    @DisplayName("任一端超长时整组丢弃")
    void testLongTupleDropped() throws IOException {
        BilingualRecipe recipe = BilingualRecipe.wordLevel("de", "en", true, false, false);
        IndexedVocabulary sourceVocabulary = recipe.makeSourceVocabulary(List.of(sourceFile));
        IndexedVocabulary targetVocabulary = recipe.makeTargetVocabulary(List.of(targetFile));
        CorpusConfig config = config("bounded");
        config.setMaxLength(3);

        try (ParallelTokenStore store = recipe.makeCorpus(List.of(sourceFile), List.of(targetFile),
            sourceVocabulary, targetVocabulary, config)) {
            assertEquals(1, store.size());
            assertEquals(List.of("Ein Hund", "A dog"), store.strings(0));
        }
    }

    @Test
    void testSplitRejected() throws IOException {
        BilingualRecipe recipe = BilingualRecipe.wordLevel("de", "en", true, false, false);
        IndexedVocabulary sourceVocabulary = recipe.makeSourceVocabulary(List.of(sourceFile));
        IndexedVocabulary targetVocabulary = recipe.makeTargetVocabulary(List.of(targetFile));
        CorpusConfig config = config("split");
        config.setMaxLength(3);
        config.setSplit(true);

        assertThrows(IllegalArgumentException.class, () -> recipe.makeCorpus(List.of(sourceFile),
            List.of(targetFile), sourceVocabulary, targetVocabulary, config));
    }

    @Test
    void testNullSideRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new BilingualRecipe(MonolingualRecipe.wordLevel("de", true, false, false), null));
    }

    private CorpusConfig config(String name) {
        CorpusConfig config = CorpusConfig.defaults();
        config.setOutputPath(tempDir.resolve("out").resolve(name).toString());
        return config;
    }
}
