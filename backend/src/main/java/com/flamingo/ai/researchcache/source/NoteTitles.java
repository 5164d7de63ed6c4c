package com.flamingo.ai.researchcache.source;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Derives a title for a note, which the remote stores as HTML without a title field. */
final class NoteTitles {

  static final String UNTITLED = "Untitled";

  private static final Pattern H1 =
      Pattern.compile("<h1[^>]*>(.*?)</h1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern BLOCK_END =
      Pattern.compile("</(p|div|h[1-6]|li)>|<br\\s*/?>", Pattern.CASE_INSENSITIVE);
  private static final Pattern TAG = Pattern.compile("<[^>]+>");

  private NoteTitles() {}

  /** The first {@code <h1>}, otherwise the first non-empty line of text. */
  static String fromHtml(String html) {
    Matcher h1 = H1.matcher(html);
    if (h1.find()) {
      String heading = plain(h1.group(1)).strip();
      if (!heading.isEmpty()) {
        return heading;
      }
    }
    String text = plain(BLOCK_END.matcher(html).replaceAll("\n"));
    for (String line : text.split("\n")) {
      if (!line.isBlank()) {
        return line.strip();
      }
    }
    return UNTITLED;
  }

  private static String plain(String html) {
    return TAG.matcher(html)
        .replaceAll("")
        .replace("&nbsp;", " ")
        .replace("&lt;", "<")
        .replace("&gt;", ">")
        .replace("&quot;", "\"")
        .replace("&#39;", "'")
        .replace("&amp;", "&");
  }
}
