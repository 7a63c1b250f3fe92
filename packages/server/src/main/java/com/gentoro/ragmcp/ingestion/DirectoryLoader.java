package com.gentoro.ragmcp.ingestion;

import com.gentoro.ragmcp.exception.IoException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads every regular file below a resource directory as UTF-8 text. Hidden files and files that
 * are not valid UTF-8 are skipped. Documents are returned ordered by relative path so chunk
 * positions are stable across runs.
 */
public class DirectoryLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(DirectoryLoader.class);

  public List<SourceDocument> load(String resourceName, Path directory) {
    if (!Files.isDirectory(directory)) {
      throw new IoException("Resource directory not found: " + directory);
    }

    List<Path> files;
    try (Stream<Path> walk = Files.walk(directory)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(p -> !isHidden(directory.relativize(p)))
              .sorted(Comparator.comparing(p -> relativeName(directory, p)))
              .collect(Collectors.toList());
    } catch (IOException e) {
      throw new IoException("Failed to list resource directory: " + directory, e);
    }

    List<SourceDocument> documents = new ArrayList<>(files.size());
    for (Path file : files) {
      String relative = relativeName(directory, file);
      String text;
      try {
        text = decode(Files.readAllBytes(file));
      } catch (CharacterCodingException e) {
        log.warn("Skipping {}/{}: not UTF-8 text", resourceName, relative);
        continue;
      } catch (IOException e) {
        throw new IoException("Failed to read resource file: " + file, e);
      }
      documents.add(new SourceDocument(resourceName, relative, text));
    }
    log.debug("Loaded {} document(s) for resource {}", documents.size(), resourceName);
    return documents;
  }

  private static String decode(byte[] bytes) throws CharacterCodingException {
    return StandardCharsets.UTF_8
        .newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(bytes))
        .toString();
  }

  private static boolean isHidden(Path relative) {
    for (Path part : relative) {
      if (part.toString().startsWith(".")) return true;
    }
    return false;
  }

  private static String relativeName(Path root, Path file) {
    return root.relativize(file).toString().replace('\\', '/');
  }
}
