package io.b2mash.usagereport.enrichment;

import io.b2mash.usagereport.config.UsageReportProperties;
import io.b2mash.usagereport.config.UsageReportProperties.AccountTierDefinition;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps a user's directory groups to premium account tier tags. Several groups may grant the same
 * tier (for example {@code priority} and {@code priority1}); each tier is reported at most once,
 * in the order the tier table declares them.
 */
@Component
public class AccountTierResolver {

  private final List<AccountTierDefinition> tiers;

  public AccountTierResolver(UsageReportProperties properties) {
    this.tiers = properties.accountTiers();
  }

  public List<String> tiersFor(Collection<String> groupNames) {
    var memberOf = new HashSet<>(groupNames);
    var result = new ArrayList<String>();
    for (var tier : tiers) {
      if (!result.contains(tier.tag()) && tier.groups().stream().anyMatch(memberOf::contains)) {
        result.add(tier.tag());
      }
    }
    return result;
  }
}
