/**
 * Spring configuration: typed properties ({@code lossguard.spike.*}, {@code lossguard.run.*}),
 * monitor wiring and request logging context.
 *
 * @since 1.0
 */
package com.phillippitts.lossguard.config;
