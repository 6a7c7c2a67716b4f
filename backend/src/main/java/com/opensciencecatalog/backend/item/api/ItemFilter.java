package com.opensciencecatalog.backend.item.api;

import com.opensciencecatalog.backend.submission.InvalidSubmissionException;
import java.util.Locale;

/** Which items {@code GET /api/items} returns: open submissions or files already on main. */
public enum ItemFilter {
  PENDING,
  CONFIRMED;

  public static ItemFilter fromString(String value) {
    if (value == null || value.isBlank()) {
      return CONFIRMED;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "pending" -> PENDING;
      case "confirmed" -> CONFIRMED;
      default -> throw new InvalidSubmissionException("Unsupported item filter '" + value + "'");
    };
  }
}
