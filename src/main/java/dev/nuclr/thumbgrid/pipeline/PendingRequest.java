package dev.nuclr.thumbgrid.pipeline;

/**
 * Work item handed from the UI thread to a generation worker.
 */
public record PendingRequest(int index, String displayPath, String contentKey) {}
