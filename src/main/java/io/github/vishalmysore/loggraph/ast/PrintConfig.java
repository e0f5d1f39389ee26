package io.github.vishalmysore.loggraph.ast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Delimiters and content options used by {@link AstPrinter}.
 */
@Data
@Builder
@AllArgsConstructor
public class PrintConfig {
    @Builder.Default
    private String open = "(";   // printed before the arguments of a composite
    @Builder.Default
    private String close = ")";
    @Builder.Default
    private String sep = ", ";
    @Builder.Default
    private PrintOption option = PrintOption.VALUE;

    public static PrintConfig valueOnly() {
        return PrintConfig.builder().build();
    }

    public static PrintConfig of(PrintOption option) {
        return PrintConfig.builder().option(option).build();
    }
}
