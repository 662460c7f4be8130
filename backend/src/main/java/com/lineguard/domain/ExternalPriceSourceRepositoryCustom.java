package com.lineguard.domain;

import java.util.List;

/**
 * Full-text lookup of vendor prices by item name.
 */
public interface ExternalPriceSourceRepositoryCustom {

    List<ExternalPriceSource> searchByItemName(String itemName, String currency, int limit);
}
