package org.dependencytrack.cvss.cli;

enum OutputFormat {

    JSON,
    TEXT

}
