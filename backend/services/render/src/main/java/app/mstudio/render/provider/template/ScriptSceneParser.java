package app.mstudio.render.provider.template;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a script into storyboard scenes. Explicit "Scene N:" markers win, then blank-line paragraphs, then
 * chunks of up to three sentences or fifty words.
 */
public final class ScriptSceneParser {

    static final int MIN_SCENES = 3;
    static final int MAX_SCENES = 12;

    private static final int CHUNK_WORDS = 50;
    private static final int CHUNK_SENTENCES = 3;

    private static final Pattern SCENE_MARKER = Pattern.compile(
            "(?:^|\\n)\\s*scene\\s*(?:\\d+|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve)\\s*[:.\\-—]",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DIRECTION = Pattern.compile("^\\s*\\[([^\\]]+)]\\s*");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    private ScriptSceneParser() {
    }

    public record Scene(String text, String direction) {
    }

    public static List<Scene> parse(String script) {
        String trimmed = script == null ? "" : script.trim();
        if (trimmed.isEmpty()) {
            return List.of(new Scene("No script provided.", "Opening"));
        }

        List<Scene> marked = byMarkers(trimmed);
        if (marked.size() >= MIN_SCENES) {
            return limit(marked);
        }

        List<String> paragraphs = Arrays.stream(PARAGRAPH_BREAK.split(trimmed))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
        if (paragraphs.size() >= MIN_SCENES) {
            return limit(paragraphs.stream().map(ScriptSceneParser::scene).toList());
        }

        List<Scene> scenes = bySentences(trimmed);
        while (scenes.size() < MIN_SCENES) {
            scenes.add(new Scene("...", ""));
        }
        return limit(scenes);
    }

    private static List<Scene> byMarkers(String script) {
        Matcher matcher = SCENE_MARKER.matcher(script);
        List<int[]> markers = new ArrayList<>();
        while (matcher.find()) {
            markers.add(new int[]{matcher.start(), matcher.end()});
        }
        List<Scene> scenes = new ArrayList<>();
        if (markers.size() < 2) {
            return scenes;
        }
        for (int i = 0; i < markers.size(); i++) {
            int end = i + 1 < markers.size() ? markers.get(i + 1)[0] : script.length();
            String raw = script.substring(markers.get(i)[1], end).trim();
            if (!raw.isEmpty()) {
                scenes.add(scene(raw));
            }
        }
        return scenes;
    }

    private static List<Scene> bySentences(String script) {
        List<Scene> scenes = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int words = 0;
        for (String sentence : SENTENCE_BREAK.split(script)) {
            if (sentence.isBlank()) {
                continue;
            }
            current.add(sentence);
            words += sentence.trim().split("\\s+").length;
            if (words >= CHUNK_WORDS || current.size() >= CHUNK_SENTENCES) {
                scenes.add(scene(String.join(" ", current)));
                current.clear();
                words = 0;
            }
        }
        if (!current.isEmpty()) {
            scenes.add(scene(String.join(" ", current)));
        }
        return scenes;
    }

    private static Scene scene(String raw) {
        Matcher matcher = DIRECTION.matcher(raw);
        if (matcher.find()) {
            String clean = raw.substring(matcher.end()).trim();
            return new Scene(clean.isEmpty() ? raw : clean, matcher.group(1).trim());
        }
        return new Scene(raw.trim(), "");
    }

    private static List<Scene> limit(List<Scene> scenes) {
        return scenes.size() > MAX_SCENES ? new ArrayList<>(scenes.subList(0, MAX_SCENES)) : scenes;
    }
}
