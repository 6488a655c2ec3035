package org.hypertrace.core.eventsearch.api.spi;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read only lookups against the organization, project, release, issue and team catalog. Calls are
 * blocking; retries and caching belong to the implementation.
 */
public interface CatalogService {

  /** Slugs of the given projects, keyed by slug. Unknown ids are absent from the map. */
  Map<String, Long> resolveProjectSlugs(Collection<Long> projectIds);

  /**
   * Versions of the releases matching the filter, ordered closest to the filtered value first and
   * at most {@code limit} long.
   */
  List<String> resolveReleaseVersions(
      ReleaseVersionFilter filter, Collection<Long> projectIds, int limit);

  /** Most recent release version of each project; empty when a project has no release. */
  List<String> resolveLatestReleases(long organizationId, Collection<Long> projectIds);

  List<KeyTransaction> resolveTeamKeyTransactions(
      long organizationId, Collection<Long> teamIds, Collection<Long> projectIds);

  ThresholdConfigs resolveThresholdConfigs(long organizationId, Collection<Long> projectIds);

  /** Issue ids keyed by their short, human readable codes. Unknown codes are absent. */
  Map<String, Long> resolveIssueIds(long organizationId, Collection<String> shortIds);

  /** Short codes keyed by issue id. */
  Map<Long, String> resolveIssueShortIds(Collection<Long> issueIds);
}
