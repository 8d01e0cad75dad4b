package org.blocksync.registry.features.music;

import org.blocksync.registry.BlockCategory;
import org.blocksync.registry.BlockKind;
import org.blocksync.registry.BlockKindRegistry;
import org.blocksync.registry.Fragment;
import org.blocksync.registry.pattern.RegexMatcher;

/**
 * Tone, rest and recording blocks. Frequencies, beat lengths and recorded note lists are fields.
 */
public final class MusicBlocks {

    private static final String BEATS = "(?:\\d+(?:\\.\\d+)?)";
    private static final String NO_RECORDING = "[]";

    private MusicBlocks() {
    }

    public static void register(BlockKindRegistry registry) {
        // A looping tone renders like ring_tone, so it comes back as one.
        registry.register(BlockKind.statement("music_play_tone", BlockCategory.MUSIC)
                .field("NOTE", "262")
                .field("DURATION", "1")
                .field("MODE", "until_done")
                .gated()
                .render((node, ctx) -> "loop".equals(node.field("MODE"))
                        ? Fragment.line("music.ring_tone(" + node.field("NOTE") + ")")
                        : Fragment.line("music.play_tone(" + node.field("NOTE") + ", " + node.field("DURATION") + ")"))
                .pattern(new RegexMatcher("music\\.play_tone\\((?<NOTE>\\d+), (?<DURATION>" + BEATS + ")\\)"))
                .tooltip("Play a tone of a frequency for a number of beats")
                .build());

        registry.register(BlockKind.statement("music_ring_tone", BlockCategory.MUSIC)
                .field("FREQ", "262")
                .gated()
                .render((node, ctx) -> Fragment.line("music.ring_tone(" + node.field("FREQ") + ")"))
                .pattern(new RegexMatcher("music\\.ring_tone\\((?<FREQ>\\d+)\\)"))
                .tooltip("Play a tone continuously")
                .build());

        registry.register(BlockKind.statement("music_rest", BlockCategory.MUSIC)
                .field("DURATION", "1")
                .gated()
                .render((node, ctx) -> Fragment.line("music.rest(" + node.field("DURATION") + ")"))
                .pattern(new RegexMatcher("music\\.rest\\((?<DURATION>" + BEATS + ")\\)"))
                .tooltip("Rest for a number of beats")
                .build());

        // The recorder field holds the note list literally, e.g. [262, 294, 330].
        registry.register(BlockKind.statement("music_record_and_play", BlockCategory.MUSIC)
                .field("RECORDER", NO_RECORDING)
                .gated()
                .awaited()
                .render((node, ctx) -> Fragment.line("await music.record_and_play(" + recording(node.field("RECORDER")) + ")"))
                .pattern(new RegexMatcher("(?:await )?music\\.record_and_play\\((?<RECORDER>.*)\\)"))
                .tooltip("Record a sequence of notes and play them back")
                .build());
    }

    private static String recording(String recorder) {
        return recorder == null || recorder.isBlank() ? NO_RECORDING : recorder.strip();
    }
}
