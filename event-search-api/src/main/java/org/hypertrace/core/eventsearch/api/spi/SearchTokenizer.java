package org.hypertrace.core.eventsearch.api.spi;

import java.util.List;
import org.hypertrace.core.eventsearch.api.ParsedTerm;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchParseException;

/** Turns search text into terms. Implemented outside of the compiler. */
public interface SearchTokenizer {

  /**
   * @throws SearchParseException when the text is malformed
   */
  List<ParsedTerm> parse(String query, RequestParams params);
}
