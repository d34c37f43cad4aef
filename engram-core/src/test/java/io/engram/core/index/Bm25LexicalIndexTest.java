package io.engram.core.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class Bm25LexicalIndexTest {

    @Test
    void shouldRankDocumentsContainingRarerTermsHigher() {
        Bm25LexicalIndex index = new Bm25LexicalIndex();
        index.index("u1", "User diet is vegetarian");
        index.index("u2", "User diet is pescatarian");
        index.index("u3", "User plays chess");

        List<ScoredId> results = index.search("pescatarian diet", 10);

        assertThat(results).extracting(ScoredId::id).containsExactly("u2", "u1");
        assertThat(results.get(0).score()).isGreaterThan(results.get(1).score());
    }

    @Test
    void reindexingShouldReplaceThePreviousText() {
        Bm25LexicalIndex index = new Bm25LexicalIndex();
        index.index("u1", "tennis on weekends");
        index.index("u1", "painting watercolours");

        assertThat(index.size()).isEqualTo(1);
        assertThat(index.search("tennis", 5)).isEmpty();
        assertThat(index.search("watercolours", 5)).extracting(ScoredId::id).containsExactly("u1");
    }

    @Test
    void stopWordOnlyQueryShouldMatchNothing() {
        Bm25LexicalIndex index = new Bm25LexicalIndex();
        index.index("u1", "what the user said");

        assertThat(index.search("what is my", 5)).isEmpty();
        assertThat(Tokenizer.tokenize("What's my diet now?")).containsExactly("diet");
    }
}
