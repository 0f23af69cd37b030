package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import io.github.hide212131.langchain4j.agentcore.runtime.VisibilityLog;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * ディレクトリまたは ZIP からスキルを読み込む。
 *
 * <p>
 * ディレクトリの場合は {@link #SCAN_DIRECTORIES} を再帰的に走査し、加えて直下の SKILL.md 以外の Markdown を取り込む。
 * ZIP の場合は SKILL.md のあるディレクトリを基点にし、それより外のエントリは読まない。
 */
public final class SkillLoader {

    public static final String MANIFEST = "SKILL.md";
    static final List<String> SCAN_DIRECTORIES = List.of("scripts", "references", "assets", "templates", "core");

    private static final VisibilityLog LOG = VisibilityLog.forClass(SkillLoader.class);

    private SkillLoader() {
        throw new AssertionError("インスタンス化できません");
    }

    public static LoadedSkill fromDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Path is not a directory: " + directory);
        }
        Path manifest = directory.resolve(MANIFEST);
        if (!Files.exists(manifest)) {
            throw new IllegalArgumentException("SKILL.md not found in " + directory);
        }
        ParsedSkill skill;
        try {
            skill = SkillManifestParser.parse(Files.readString(manifest, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read SKILL.md: " + ex.getMessage(), ex);
        }

        Map<String, SkillFile> files = new HashMap<>();
        for (String scanDirectory : SCAN_DIRECTORIES) {
            Path sub = directory.resolve(scanDirectory);
            if (Files.isDirectory(sub)) {
                collect(sub, scanDirectory, files);
            }
        }
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile).forEach(path -> {
                String fileName = path.getFileName().toString();
                if (fileName.endsWith(".md") && !MANIFEST.equals(fileName)) {
                    readText(path).ifPresent(content -> files.put(fileName, new SkillFile(content,
                            SkillFileType.MARKDOWN)));
                }
            });
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read directory " + directory + ": " + ex.getMessage(), ex);
        }
        LOG.debug("-", "-", "skill", skill.name(), "スキルを読み込みました: files=" + files.size());
        return new LoadedSkill(skill, files);
    }

    public static LoadedSkill fromZip(Path zipPath) {
        Objects.requireNonNull(zipPath, "zipPath");
        try (ZipFile zip = new ZipFile(zipPath.toFile(), StandardCharsets.UTF_8)) {
            String baseDir = "";
            Enumeration<? extends ZipEntry> scan = zip.entries();
            while (scan.hasMoreElements()) {
                String name = scan.nextElement().getName();
                if (MANIFEST.equals(name.substring(name.lastIndexOf('/') + 1))) {
                    baseDir = name.substring(0, name.length() - MANIFEST.length());
                    break;
                }
            }

            String manifest = null;
            Map<String, SkillFile> files = new HashMap<>();
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory() || !entry.getName().startsWith(baseDir)) {
                    continue;
                }
                String relative = entry.getName().substring(baseDir.length());
                String content = readEntry(zip, entry);
                if (content == null) {
                    continue;
                }
                if (MANIFEST.equals(relative)) {
                    manifest = content;
                } else if (SkillFileType.isAllowed(relative)) {
                    files.put(relative, new SkillFile(content, SkillFileType.detect(relative)));
                }
            }
            if (manifest == null) {
                throw new IllegalArgumentException("SKILL.md not found in ZIP archive");
            }
            return new LoadedSkill(SkillManifestParser.parse(manifest), files);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read ZIP archive: " + ex.getMessage(), ex);
        }
    }

    /** 拡張子でディレクトリか ZIP かを判定して読み込む。 */
    public static LoadedSkill load(Path path) {
        Objects.requireNonNull(path, "path");
        if (Files.isRegularFile(path) && path.getFileName().toString().toLowerCase(Locale.ROOT)
                .endsWith(".zip")) {
            return fromZip(path);
        }
        return fromDirectory(path);
    }

    private static void collect(Path directory, String relativeBase, Map<String, SkillFile> files) {
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path path : (Iterable<Path>) entries.sorted()::iterator) {
                String fileName = path.getFileName().toString();
                String relative = relativeBase + "/" + fileName;
                if (Files.isDirectory(path)) {
                    collect(path, relative, files);
                } else if (Files.isRegularFile(path) && SkillFileType.isAllowed(fileName)) {
                    readText(path).ifPresent(
                            content -> files.put(relative, new SkillFile(content, SkillFileType.detect(fileName))));
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read directory " + directory + ": " + ex.getMessage(), ex);
        }
    }

    private static Optional<String> readText(Path path) {
        try {
            return Optional.of(decode(Files.readAllBytes(path)));
        } catch (IOException ex) {
            LOG.debug("-", "-", "skill", path.toString(), "読み込めないファイルを読み飛ばしました: " + ex.getMessage());
            return Optional.empty();
        }
    }

    private static String readEntry(ZipFile zip, ZipEntry entry) throws IOException {
        try (InputStream input = zip.getInputStream(entry)) {
            return decode(input.readAllBytes());
        } catch (CharacterCodingException ex) {
            LOG.debug("-", "-", "skill", entry.getName(), "UTF-8 でないエントリを読み飛ばしました");
            return null;
        }
    }

    // UTF-8 として不正なバイト列は読み込み失敗として扱う
    private static String decode(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(bytes)).toString();
    }
}
