module com.hedgedata.data {
    // Exports - public API
    exports com.hedgedata.data;
    exports com.hedgedata.data.cache;
    exports com.hedgedata.data.compare;
    exports com.hedgedata.data.exception;
    exports com.hedgedata.data.provider;

    // Internal modules
    requires transitive com.hedgedata.core;

    // Data/IO
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;
    requires com.fasterxml.jackson.dataformat.yaml;
    requires okhttp3;

    // Logging
    requires org.slf4j;

    // Jackson reflection access (YAML config model)
    opens com.hedgedata.data to com.fasterxml.jackson.databind;
}
