/**
 * Task 실행 엔진.
 *
 * <p>이 패키지는 지연 평가되는 Task 자료구조와 그 실행 알고리즘을 담당합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.halfling.core.task.Task} - 지연 계산 노드 (조합, 상태 조회, 실행 진입점)</li>
 *   <li>{@link com.ryuqq.halfling.core.task.AsyncHandle} - 한 번만 기록되는 Result 셀</li>
 *   <li>{@link com.ryuqq.halfling.core.task.ExecutionMode} - SERIAL / PARALLEL</li>
 *   <li>{@code TaskInterpreter} - 직렬/병렬 인터프리터 (패키지 내부)</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>지연성:</strong> 조합은 아무것도 실행하지 않음</li>
 *   <li><strong>Copy-on-write:</strong> 모든 조합은 새 Task 반환</li>
 *   <li><strong>예외 경계:</strong> 사용자 예외는 Result.attempt에서만 Failure로 변환</li>
 *   <li><strong>재실행:</strong> 소진된 Task에 붙인 suffix만 다시 실행</li>
 * </ul>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
package com.ryuqq.halfling.core.task;
