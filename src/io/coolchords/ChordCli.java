package io.coolchords;

import io.coolchords.midi.HeldNotes;
import io.coolchords.midi.MidiInputDecoder;
import io.coolchords.midi.MidiNoteCodec;
import io.coolchords.midi.MidiNoteEvent;
import io.coolchords.midi.MidiNoteListener;
import io.coolchords.presets.ChordFilterPreset;
import io.coolchords.presets.ChordFilterPresets;
import io.coolchords.text.ChordNameNormalizer;
import io.coolchords.text.ChordValidationResult;
import io.coolchords.text.ChordValidator;
import io.coolchords.theory.Chord;
import io.coolchords.theory.ChordBuilder;
import io.coolchords.theory.ChordInversions;
import io.coolchords.theory.ChordQuality;
import io.coolchords.theory.ChordRecognizer;
import io.coolchords.theory.ChordSampler;
import io.coolchords.theory.PitchClass;
import io.coolchords.theory.PitchedNote;

import javax.sound.midi.MidiSystem;
import javax.sound.midi.MidiUnavailableException;
import javax.sound.midi.Transmitter;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds, names and checks chords from the command line, and prints the chords held on a MIDI keyboard.
 *
 * <p>Usage: java ChordCli build C major 4</p>
 */
public final class ChordCli {
    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_INPUT_ERROR = 2;

    private static final String DEFAULT_PRESET = "ALL_MAJOR_MINOR_TRIADS";
    private static final Logger ROOT_LOGGER = Logger.getLogger("io.coolchords");

    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    private ChordCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Runs one command.
     * @return 0 on success, 1 for a usage error, 2 when the input is rejected
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        var cli = new ChordCli(out, err);
        if (args.length < 1 || args[0].isBlank()) {
            cli.printOptions();
            return EXIT_USAGE;
        }

        List<String> positional = new ArrayList<>();
        String presetKey = null;
        File presetsFile = null;
        Long seed = null;
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "-V", "--version" -> {
                    cli.printVersion();
                    return EXIT_OK;
                }
                case "-H", "--help", "-h" -> {
                    cli.printOptions();
                    return EXIT_OK;
                }
                case "-v", "--verbose" -> enableVerboseLogging();
                case "--preset", "--presets", "--seed" -> {
                    if (i + 1 >= args.length) {
                        err.println("Missing value for " + arg);
                        return EXIT_USAGE;
                    }
                    var value = args[++i];
                    switch (arg) {
                        case "--preset" -> presetKey = value;
                        case "--presets" -> presetsFile = new File(value);
                        default -> {
                            try {
                                seed = Long.parseLong(value);
                            } catch (NumberFormatException e) {
                                err.println("Not a seed: " + value);
                                return EXIT_USAGE;
                            }
                        }
                    }
                }
                default -> positional.add(arg);
            }
        }

        if (positional.isEmpty()) {
            cli.printOptions();
            return EXIT_USAGE;
        }

        var command = positional.get(0);
        var params = positional.subList(1, positional.size());
        try {
            return switch (command) {
                case "build" -> cli.build(params);
                case "identify" -> cli.identify(params);
                case "inversions" -> cli.inversions(params);
                case "normalize" -> cli.normalize(params);
                case "check" -> cli.check(params);
                case "random" -> cli.random(presetKey, presetsFile, seed);
                case "midi" -> cli.midi(params);
                case "listen" -> cli.listen();
                default -> {
                    err.println("Unknown command: " + command);
                    cli.printOptions();
                    yield EXIT_USAGE;
                }
            };
        } catch (RuntimeException e) {
            err.println(e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    private int build(List<String> params) {
        if (params.size() < 3 || params.size() > 4)
            return usage("build <root> <quality> <octave> [inversion]");

        int inversion = params.size() == 4 ? parseInt(params.get(3), "inversion") : 0;
        Chord chord = ChordBuilder.build(parseRoot(params.get(0)), parseQuality(params.get(1)),
                parseInt(params.get(2), "octave"), inversion);
        out.println(chord);
        return EXIT_OK;
    }

    private int identify(List<String> params) {
        if (params.isEmpty())
            return usage("identify <note> <note> ...");

        List<PitchedNote> notes = params.stream().map(ChordCli::parseNote).toList();
        Optional<Chord> chord = ChordRecognizer.identify(notes);
        if (chord.isEmpty()) {
            out.println("No chord matches " + notes);
            return EXIT_INPUT_ERROR;
        }
        out.printf("%s (%s, inversion %d)\n", chord.get().name(), chord.get().quality().displayName(), chord.get().inversion());
        return EXIT_OK;
    }

    private int inversions(List<String> params) {
        if (params.size() < 3 || params.size() > 4)
            return usage("inversions <root> <quality> <octave> [max]");

        var quality = parseQuality(params.get(1));
        int max = params.size() == 4 ? parseInt(params.get(3), "max") : quality.noteCount() - 1;
        Chord chord = ChordBuilder.build(parseRoot(params.get(0)), quality, parseInt(params.get(2), "octave"));
        var voicings = ChordInversions.generateInversions(chord.notes(), max);
        for (int i = 0; i < voicings.size(); i++) {
            out.printf("%d: %s\n", i, voicings.get(i));
        }
        return EXIT_OK;
    }

    private int normalize(List<String> params) {
        if (params.isEmpty())
            return usage("normalize <text>");

        var normalized = ChordNameNormalizer.normalize(String.join(" ", params));
        if (normalized.isEmpty()) {
            err.println("Not a chord name: " + String.join(" ", params));
            return EXIT_INPUT_ERROR;
        }
        out.println(normalized);
        return EXIT_OK;
    }

    private int check(List<String> params) {
        if (params.size() < 4 || params.size() > 5)
            return usage("check <guess> <root> <quality> <octave> [inversion]");

        int inversion = params.size() == 5 ? parseInt(params.get(4), "inversion") : 0;
        Chord target = ChordBuilder.build(parseRoot(params.get(1)), parseQuality(params.get(2)),
                parseInt(params.get(3), "octave"), inversion);
        ChordValidationResult result = ChordValidator.validate(params.get(0), target);
        if (result.isCorrect()) {
            out.println(result.isEnharmonic() ? "Correct (enharmonic spelling of " + target.name() + ")." : "Correct.");
            return EXIT_OK;
        }
        out.println(result.feedbackMessage().orElse("Incorrect."));
        return EXIT_INPUT_ERROR;
    }

    private int random(String presetKey, File presetsFile, Long seed) {
        var presets = presetsFile == null ? ChordFilterPresets.load() : ChordFilterPresets.load(presetsFile);
        var key = presetKey == null ? DEFAULT_PRESET : presetKey;
        Optional<ChordFilterPreset> preset = presets.get(key).or(() -> presets.getByName(key));
        if (preset.isEmpty()) {
            err.println("Unknown preset: " + key + ". Available: " + String.join(", ", presets.keys()));
            return EXIT_INPUT_ERROR;
        }

        var sampler = seed == null ? new ChordSampler() : new ChordSampler(new Random(seed));
        out.println(sampler.sampleRandom(preset.get().filter()));
        return EXIT_OK;
    }

    private int midi(List<String> params) {
        if (params.size() != 1)
            return usage("midi <number> | <note>");

        var arg = params.get(0);
        if (arg.chars().allMatch(Character::isDigit)) {
            out.println(MidiNoteCodec.fromMidi(parseInt(arg, "MIDI note number")));
        } else {
            out.println(MidiNoteCodec.toMidi(parseNote(arg)));
        }
        return EXIT_OK;
    }

    private int listen() {
        var held = new HeldNotes();
        var printer = new MidiNoteListener() {
            private String last = "";

            @Override
            public void noteOn(MidiNoteEvent event) {
                held.noteOn(event);
                print();
            }

            @Override
            public void noteOff(MidiNoteEvent event) {
                held.noteOff(event);
                print();
            }

            private synchronized void print() {
                var line = held.currentChord().map(Chord::name).orElse(held.snapshot().toString());
                if (!line.equals(last)) {
                    out.println(line);
                    last = line;
                }
            }
        };

        try (Transmitter transmitter = MidiSystem.getTransmitter();
             var decoder = new MidiInputDecoder(printer)) {
            transmitter.setReceiver(decoder);
            out.println("Listening on the default MIDI input. Press Enter to stop.");
            System.in.read();
            return EXIT_OK;
        } catch (MidiUnavailableException e) {
            err.println("No MIDI input available: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IOException e) {
            err.println("Failed to read from the console: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    private int usage(String synopsis) {
        err.println("Usage: cchords " + synopsis);
        return EXIT_USAGE;
    }

    private static PitchClass parseRoot(String text) {
        return ChordNameNormalizer.normalizeNote(text)
                .orElseThrow(() -> new IllegalArgumentException("Not a note name: " + text));
    }

    /** Accepts preset keys ("halfDiminished7") and enum names ("HALF_DIMINISHED7"), ignoring case */
    private static ChordQuality parseQuality(String text) {
        for (var quality : ChordQuality.values()) {
            if (quality.key.equalsIgnoreCase(text) || quality.name().equalsIgnoreCase(text))
                return quality;
        }
        return ChordQuality.fromKey(text);
    }

    /** A note name in any accepted spelling followed by an octave, e.g. "Db4" */
    private static PitchedNote parseNote(String text) {
        int split = text.length();
        while (split > 0 && Character.isDigit(text.charAt(split - 1)))
            split--;
        if (split == 0 || split == text.length())
            throw new IllegalArgumentException("Not a note: " + text);
        return new PitchedNote(parseRoot(text.substring(0, split)), Integer.parseInt(text.substring(split)));
    }

    private static int parseInt(String text, String what) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a valid " + what + ": " + text);
        }
    }

    private static void enableVerboseLogging() {
        ROOT_LOGGER.setLevel(Level.FINE);
        for (var handler : ROOT_LOGGER.getHandlers()) {
            if (handler instanceof ConsoleHandler)
                return;
        }
        var handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        ROOT_LOGGER.addHandler(handler);
    }

    private void printOptions() {
        String msg = "\nCOOL Chords\n\nUsage: cchords <command> [arguments]\n\n";
        msg += "Commands:\n";
        msg += "\n  build <root> <quality> <octave> [inversion]        Build a chord, e.g. build G dominant7 3 1";
        msg += "\n  identify <note> <note> ...                         Name the chord formed by the notes, e.g. identify E4 G4 C5";
        msg += "\n  inversions <root> <quality> <octave> [max]         List the inversions of a chord";
        msg += "\n  normalize <text>                                   Print the canonical spelling of a chord name";
        msg += "\n  check <guess> <root> <quality> <octave> [inv]      Check a chord name against a chord";
        msg += "\n  random [--preset KEY] [--presets FILE] [--seed N]  Pick a random chord from a preset";
        msg += "\n  midi <number> | <note>                             Convert between MIDI note numbers and notes";
        msg += "\n  listen                                             Print the chords held on the default MIDI input";
        msg += "\n\nOptions:\n";
        msg += "\n  -V,--version   Print version information";
        msg += "\n  -H,--help      Print this message";
        msg += "\n  -v,--verbose   Print extra logs";
        out.println(msg);
    }

    private void printVersion() {
        out.println("COOL Chords 0.1.0\n");
    }
}
