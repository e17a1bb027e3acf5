module com.hedgedata.runner {
    // Internal modules
    requires transitive com.hedgedata.core;
    requires com.hedgedata.data;

    // Logging
    requires org.slf4j;

    // Exports
    exports com.hedgedata.runner;
}
