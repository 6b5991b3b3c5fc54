package com.clinical.icdlookup.dto;

/**
 * State of the offline catalog.
 *
 * @param entries      rows currently committed
 * @param seedComplete whether the one-time import finished
 */
public record CatalogStatus(long entries, boolean seedComplete) {
}
