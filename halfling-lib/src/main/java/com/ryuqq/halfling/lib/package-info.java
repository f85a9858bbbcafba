/**
 * Task API 위에 만든 유틸리티.
 *
 * @author Halfling Team
 * @since 1.0.0
 */
package com.ryuqq.halfling.lib;
