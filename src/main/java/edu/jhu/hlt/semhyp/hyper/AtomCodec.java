package edu.jhu.hlt.semhyp.hyper;

import java.util.ArrayList;
import java.util.List;

/**
 * Textual form of atoms: {@code label[/type[.roles[.morph[.entity]]]]}.
 * Every part is percent-escaped so that the characters used by the edge
 * grammar ({@code % / space ( ) . * & @ CR LF}) never appear raw.
 * Role fields are separated by ':' which is not escaped.
 */
public class AtomCodec {

  public static final String RESERVED = "%/ ().*&@\n\r";

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  public static String encode(String part) {
    StringBuilder sb = null;
    for (int i = 0; i < part.length(); i++) {
      char c = part.charAt(i);
      if (RESERVED.indexOf(c) >= 0) {
        if (sb == null) {
          sb = new StringBuilder(part.length() + 8);
          sb.append(part, 0, i);
        }
        sb.append('%');
        sb.append(HEX[(c >> 4) & 0xF]);
        sb.append(HEX[c & 0xF]);
      } else if (sb != null) {
        sb.append(c);
      }
    }
    return sb == null ? part : sb.toString();
  }

  /** Replaces every %XX (hex) by the character it encodes. */
  public static String decode(String part) {
    if (part.indexOf('%') < 0)
      return part;
    StringBuilder sb = new StringBuilder(part.length());
    for (int i = 0; i < part.length(); i++) {
      char c = part.charAt(i);
      if (c == '%' && i + 2 < part.length() && isHex(part.charAt(i + 1)) && isHex(part.charAt(i + 2))) {
        sb.append((char) Integer.parseInt(part.substring(i + 1, i + 3), 16));
        i += 2;
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private static boolean isHex(char c) {
    return Character.digit(c, 16) >= 0;
  }

  public static String toString(Atom a) {
    String label = encode(a.getLabel());
    List<String> rest = new ArrayList<>(4);
    rest.add(a.getTypeCode());
    rest.add(a.getRoles());
    rest.add(a.getMorph());
    rest.add(a.getEntity());
    while (!rest.isEmpty() && rest.get(rest.size() - 1).isEmpty())
      rest.remove(rest.size() - 1);
    if (rest.isEmpty())
      return label;
    StringBuilder sb = new StringBuilder(label);
    sb.append('/');
    for (int i = 0; i < rest.size(); i++) {
      if (i > 0) sb.append('.');
      sb.append(encode(rest.get(i)));
    }
    return sb.toString();
  }

  /**
   * Parses one leaf token of the edge grammar into a {@link ContentAtom}.
   */
  public static ContentAtom parse(String token) {
    token = token.trim();
    if (token.isEmpty())
      throw new EdgeSyntaxException("empty atom", token);
    int slash = token.indexOf('/');
    if (slash < 0)
      return new ContentAtom(decode(token));
    if (token.indexOf('/', slash + 1) >= 0)
      throw new EdgeSyntaxException("more than one '/' in atom", token);
    String label = decode(token.substring(0, slash));
    String[] parts = token.substring(slash + 1).split("\\.", -1);
    if (parts.length > 4)
      throw new EdgeSyntaxException("too many '.' separated parts in atom", token);
    String[] fields = new String[] {"", "", "", ""};
    for (int i = 0; i < parts.length; i++)
      fields[i] = decode(parts[i]);
    return new ContentAtom(label, fields[0], fields[1], fields[2], fields[3]);
  }
}
