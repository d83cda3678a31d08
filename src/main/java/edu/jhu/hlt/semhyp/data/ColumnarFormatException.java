package edu.jhu.hlt.semhyp.data;

import java.io.IOException;

/**
 * A line of a columnar corpus file which could not be read.
 */
public class ColumnarFormatException extends IOException {
  private static final long serialVersionUID = 2870466254203139316L;

  private final int lineNumber;

  public ColumnarFormatException(String message, int lineNumber) {
    super(message + " (line " + lineNumber + ")");
    this.lineNumber = lineNumber;
  }

  /** 1-based, or -1 if not about a single line. */
  public int getLineNumber() {
    return lineNumber;
  }
}
