/**
 * Externally delivered events: the {@link com.tally.eventmodel.ExternalEvent} record, its JSON
 * parser and its validator. Nothing here knows about persistence or deduplication.
 */
package com.tally.eventmodel;
