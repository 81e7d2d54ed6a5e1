package org.tzcore.zone.catalog;

import org.tzcore.core.error.ReasonCode;
import org.tzcore.core.error.TimezoneException;

/**
 * Fatal catalog data defect, for example a known zone with no period covering an instant.
 */
public final class CatalogInconsistencyException extends TimezoneException {

    public CatalogInconsistencyException(String message) {
        super(ReasonCode.CATALOG_INCONSISTENT, message);
    }

    public CatalogInconsistencyException(String message, Throwable cause) {
        super(ReasonCode.CATALOG_INCONSISTENT, message, cause);
    }
}
