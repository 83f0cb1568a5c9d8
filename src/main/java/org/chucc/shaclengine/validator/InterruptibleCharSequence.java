package org.chucc.shaclengine.validator;

import org.chucc.shaclengine.exception.ShaclEngineException;

/**
 * Character sequence that stops regex matching once the current thread is
 * interrupted. {@link java.util.regex.Matcher} reads every character through
 * {@link #charAt(int)}, so a backtracking pattern gives up promptly when its
 * validation unit is aborted.
 */
final class InterruptibleCharSequence implements CharSequence {

  private final CharSequence inner;

  InterruptibleCharSequence(CharSequence inner) {
    this.inner = inner;
  }

  @Override
  public char charAt(int index) {
    if (Thread.currentThread().isInterrupted()) {
      throw new ShaclEngineException("Pattern matching interrupted", "interrupted");
    }
    return inner.charAt(index);
  }

  @Override
  public int length() {
    return inner.length();
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    return new InterruptibleCharSequence(inner.subSequence(start, end));
  }

  @Override
  public String toString() {
    return inner.toString();
  }
}
