package com.flamingo.ai.pagereader.service.extraction;

import com.flamingo.ai.pagereader.domain.enums.DocumentFormat;
import com.flamingo.ai.pagereader.domain.model.TextBlock;
import com.flamingo.ai.pagereader.exception.DocumentProcessingException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

/**
 * EPUB extraction: container manifest, package document, spine order, then each chapter's markup
 * reduced to text with block boundaries kept as blank lines. EPUB has no fixed pages, so the joined
 * text is split into synthetic pages.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EpubTextExtractor implements DocumentExtractor {

  private static final String CONTAINER_PATH = "META-INF/container.xml";
  private static final long MAX_UNCOMPRESSED_BYTES = 512L * 1024 * 1024;

  private static final Set<String> BLOCK_TAGS =
      Set.of(
          "p", "div", "section", "article", "h1", "h2", "h3", "h4", "h5", "h6", "li", "ul", "ol",
          "blockquote");
  private static final Set<String> SKIPPED_TAGS = Set.of("script", "style", "head", "title", "nav");

  private final Paginator paginator;

  @Override
  public ExtractionResult extract(RawUpload upload, ExtractionListener listener) {
    Map<String, byte[]> entries = unzip(upload.bytes());

    byte[] container = entries.get(CONTAINER_PATH);
    if (container == null) {
      throw new DocumentProcessingException(null, "Invalid EPUB: missing " + CONTAINER_PATH);
    }
    String opfPath = findPackagePath(container);
    byte[] opf = lookup(entries, opfPath);
    if (opf == null) {
      throw new DocumentProcessingException(null, "Invalid EPUB: missing package " + opfPath);
    }

    PackageDocument pkg = parsePackage(opf);
    String baseDir =
        opfPath.contains("/") ? opfPath.substring(0, opfPath.lastIndexOf('/') + 1) : "";

    List<String> chapters = new ArrayList<>();
    for (String href : pkg.spineHrefs()) {
      String path = resolve(baseDir, href);
      byte[] chapter = lookup(entries, path);
      if (chapter == null) {
        log.warn("EPUB spine item {} not found in archive, skipping", path);
        continue;
      }
      String text = normalize(htmlToText(new String(chapter, StandardCharsets.UTF_8)));
      if (!text.isEmpty()) {
        chapters.add(text);
      }
    }
    String combined = String.join("\n\n", chapters).strip();

    List<TextBlock> blocks = paginator.paginate(combined);
    int pageCount = blocks.get(blocks.size() - 1).pageNumber();
    String title = pkg.title() != null ? pkg.title() : upload.baseName();
    ExtractedMetadata metadata = new ExtractedMetadata(title, pkg.author(), pageCount, false);
    listener.onMetadata(metadata);

    log.debug(
        "EPUB {} read {} chapters into {} synthetic pages",
        upload.fileName(),
        chapters.size(),
        pageCount);
    return new ExtractionResult(blocks, metadata, Paginator.countWords(combined));
  }

  @Override
  public boolean supports(DocumentFormat format) {
    return format == DocumentFormat.EPUB;
  }

  // ---- archive ----

  private Map<String, byte[]> unzip(byte[] bytes) {
    Map<String, byte[]> entries = new LinkedHashMap<>();
    long total = 0;
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (entry.isDirectory()) {
          continue;
        }
        byte[] content = zip.readAllBytes();
        total += content.length;
        if (total > MAX_UNCOMPRESSED_BYTES) {
          throw new DocumentProcessingException(null, "Invalid EPUB: archive expands too far");
        }
        entries.put(entry.getName(), content);
      }
    } catch (IOException e) {
      throw new DocumentProcessingException(null, "Invalid EPUB: " + e.getMessage(), e);
    }
    if (entries.isEmpty()) {
      throw new DocumentProcessingException(null, "Invalid EPUB: archive is empty");
    }
    return entries;
  }

  /** Exact lookup first, then a case-insensitive match. */
  private static byte[] lookup(Map<String, byte[]> entries, String path) {
    byte[] exact = entries.get(path);
    if (exact != null) {
      return exact;
    }
    for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(path)) {
        return entry.getValue();
      }
    }
    return null;
  }

  // ---- package document ----

  record PackageDocument(String title, String author, List<String> spineHrefs) {}

  static String findPackagePath(byte[] containerXml) {
    org.jsoup.nodes.Document doc =
        Jsoup.parse(new String(containerXml, StandardCharsets.UTF_8), "", Parser.xmlParser());
    for (Element element : doc.getAllElements()) {
      if ("rootfile".equals(localName(element))) {
        String fullPath = element.attr("full-path").strip();
        if (!fullPath.isEmpty()) {
          return fullPath;
        }
      }
    }
    throw new DocumentProcessingException(null, "Invalid EPUB: no rootfile in container");
  }

  static PackageDocument parsePackage(byte[] opf) {
    org.jsoup.nodes.Document doc =
        Jsoup.parse(new String(opf, StandardCharsets.UTF_8), "", Parser.xmlParser());
    String title = null;
    String author = null;
    Map<String, String> manifest = new HashMap<>();
    List<String> spineIds = new ArrayList<>();

    for (Element element : doc.getAllElements()) {
      switch (localName(element)) {
        case "title" -> {
          if (title == null) {
            title = blankToNull(TextSanitizer.sanitize(element.text()).strip());
          }
        }
        case "creator" -> {
          if (author == null) {
            author = blankToNull(TextSanitizer.sanitize(element.text()).strip());
          }
        }
        case "item" -> {
          String id = element.attr("id");
          String href = element.attr("href");
          if (!id.isEmpty() && !href.isEmpty()) {
            manifest.put(id, href);
          }
        }
        case "itemref" -> {
          String idref = element.attr("idref");
          if (!idref.isEmpty()) {
            spineIds.add(idref);
          }
        }
        default -> {
          // not relevant
        }
      }
    }

    List<String> hrefs = new ArrayList<>();
    for (String id : spineIds) {
      String href = manifest.get(id);
      if (href != null) {
        hrefs.add(href);
      }
    }
    return new PackageDocument(title, author, hrefs);
  }

  /** Resolves a manifest href against the package directory. */
  static String resolve(String baseDir, String href) {
    String path = href;
    int fragment = path.indexOf('#');
    if (fragment >= 0) {
      path = path.substring(0, fragment);
    }
    path = URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);

    Deque<String> segments = new ArrayDeque<>();
    for (String segment : (baseDir + path).split("/")) {
      if (segment.isEmpty() || ".".equals(segment)) {
        continue;
      }
      if ("..".equals(segment)) {
        segments.pollLast();
      } else {
        segments.addLast(segment);
      }
    }
    return String.join("/", segments);
  }

  private static String localName(Element element) {
    String name = element.tagName();
    int colon = name.indexOf(':');
    return (colon >= 0 ? name.substring(colon + 1) : name).toLowerCase(Locale.ROOT);
  }

  private static String blankToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  // ---- markup ----

  static String htmlToText(String html) {
    StringBuilder sb = new StringBuilder();
    NodeTraversor.filter(
        new NodeFilter() {
          @Override
          public FilterResult head(Node node, int depth) {
            if (node instanceof Element element) {
              String tag = element.normalName();
              if (SKIPPED_TAGS.contains(tag)) {
                return FilterResult.SKIP_ENTIRELY;
              }
              if ("br".equals(tag)) {
                sb.append('\n');
              }
              if (BLOCK_TAGS.contains(tag)) {
                sb.append("\n\n");
              }
            } else if (node instanceof TextNode textNode) {
              String text = textNode.getWholeText().strip();
              if (!text.isEmpty()) {
                if (sb.length() > 0) {
                  char last = sb.charAt(sb.length() - 1);
                  if (last != '\n' && last != ' ') {
                    sb.append(' ');
                  }
                }
                sb.append(text);
              }
            }
            return FilterResult.CONTINUE;
          }

          @Override
          public FilterResult tail(Node node, int depth) {
            if (node instanceof Element element && BLOCK_TAGS.contains(element.normalName())) {
              sb.append("\n\n");
            }
            return FilterResult.CONTINUE;
          }
        },
        Jsoup.parse(html));
    return sb.toString();
  }

  /** Normalizes line endings and non-breaking spaces and keeps at most two blank lines in a row. */
  static String normalize(String text) {
    String normalized = text.replace("\r\n", "\n").replace('\r', '\n').replace('\u00A0', ' ');
    StringBuilder out = new StringBuilder(normalized.length());
    int blank = 0;
    for (String line : normalized.split("\n", -1)) {
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        blank++;
        if (blank <= 2) {
          out.append('\n');
        }
        continue;
      }
      blank = 0;
      out.append(trimmed).append('\n');
    }
    return out.toString().strip();
  }
}
