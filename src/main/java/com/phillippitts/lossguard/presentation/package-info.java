/**
 * Presentation layer: REST controllers and exception translation for remote training jobs.
 *
 * <p>This layer only converts HTTP payloads into domain calls on
 * {@link com.phillippitts.lossguard.service.ingest.StepIngestService} and maps domain
 * exceptions to HTTP status codes. No detection logic lives here.
 *
 * @since 1.0
 */
package com.phillippitts.lossguard.presentation;
