package edu.brandeis.cosi103a.gokifu.format;

/**
 * A record file's decoded text together with the format detected from its name.
 */
public record LoadedRecord(RecordFormat format, String text) {
}
