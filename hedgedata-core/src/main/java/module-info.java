module com.hedgedata.core {
    // Exports - all public packages
    exports com.hedgedata.core.model;
    exports com.hedgedata.core.util;

    // Jackson (for record serialization)
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;

    // Jackson needs reflection access to records
    opens com.hedgedata.core.model to com.fasterxml.jackson.databind;
}
