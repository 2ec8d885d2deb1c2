/**
 * Object-detection services polled by vision triggers.
 *
 * <p>HTTP sources are registered per configured base URL ({@code vision.frigate.base-url},
 * {@code vision.codeprojectai.base-url}, {@code vision.yolo.base-url}). The {@code local} service
 * has no built-in source; an application may contribute a {@link
 * com.phillippitts.routineengine.service.vision.VisionDetectionSource} bean for it.
 */
package com.phillippitts.routineengine.service.vision;
