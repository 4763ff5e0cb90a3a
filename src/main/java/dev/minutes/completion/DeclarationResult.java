package dev.minutes.completion;

import dev.minutes.session.SessionRecord;
import org.jspecify.annotations.Nullable;

/**
 * @param session the session after the declaration
 * @param completion completion verdict, or {@code null} if the check could not run
 */
public record DeclarationResult(SessionRecord session, @Nullable CompletionResult completion) {}
