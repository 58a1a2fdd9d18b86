package aisp.java17.validator;

import aisp.java17.logic.TranslationException;
import aisp.java17.parser.LexException;
import aisp.java17.parser.ParseException;

/// Turns the located exceptions of the pipeline into [Diagnostic]s.
final class Diagnostics {
    private Diagnostics() {}

    static Diagnostic of(LexException e) {
        return Diagnostic.of(DiagnosticKind.LEX_ERROR, Location.at(e.byteOffset()), e.getMessage());
    }

    static Diagnostic of(ParseException e) {
        final Location where = e.blockTag() == null
            ? Location.at(e.byteOffset())
            : Location.in(e.blockTag(), e.byteOffset());
        return Diagnostic.of(DiagnosticKind.PARSE_ERROR, where, e.getMessage());
    }

    static Diagnostic of(SizeLimitExceededException e) {
        return Diagnostic.of(DiagnosticKind.SIZE_LIMIT_EXCEEDED, Location.nowhere(), e.getMessage());
    }

    /// A statement without a formula counterpart is a proof gap, not a failure.
    static Diagnostic of(TranslationException e) {
        return Diagnostic.of(DiagnosticKind.PROOF_UNSUPPORTED_CONSTRUCT,
            e.blockTag() == null ? Location.at(e.byteOffset()) : Location.in(e.blockTag(), e.byteOffset()),
            e.getMessage());
    }
}
