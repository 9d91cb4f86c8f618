package mf;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Thrown when a formula or library source has compile errors. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<Diagnostic> diagnostics;

  public CompilerException(List<Diagnostic> diagnostics) {
    super(summarize(diagnostics));
    this.diagnostics = ImmutableList.sortedCopyOf(diagnostics);
  }

  private static String summarize(List<Diagnostic> diagnostics) {
    Preconditions.checkArgument(!diagnostics.isEmpty(), "no diagnostics");
    String first = diagnostics.get(0).format();
    if (diagnostics.size() == 1) {
      return first;
    }
    return String.format("%s (and %d more)", first, diagnostics.size() - 1);
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public void print() {
    diagnostics.forEach(Diagnostic::print);
  }
}
