/**
 * Service layer: the encoding decision engine and the pass orchestration around it.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.process} - subprocess launching, stream draining and termination</li>
 *   <li>{@code service.probe} - typed boundary around the media prober</li>
 *   <li>{@code service.analysis} - sampled complexity signals and the composite score</li>
 *   <li>{@code service.classify} - technical classifier, content oracle and merge policy</li>
 *   <li>{@code service.profile} - profile catalog, recommendation and parameter adaptation</li>
 *   <li>{@code service.crop} - three-sample crop voting</li>
 *   <li>{@code service.encode} - filter graph, pass plans, encoder commands and pass state</li>
 *   <li>{@code service.progress} - progress parsing, estimation and the per-pass monitor</li>
 *   <li>{@code service.orchestration} - {@code decideAndEncode}, pass sequencing and batches</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans; per-run state travels in a
 *       {@link com.phillippitts.adaptiveencoder.domain.RunContext}</li>
 *   <li>Pure calculations (score, adaptation, crop vote, ETA) are static and side-effect free</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.adaptiveencoder.service;
