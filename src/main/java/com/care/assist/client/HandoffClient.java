package com.care.assist.client;

import com.care.assist.model.TransferStatus;

/**
 * 轉接（Warm Hand-off）協作者介面
 * 只由 Escalation Coordinator 呼叫
 */
public interface HandoffClient {

    /**
     * 發起一次轉接
     *
     * @param contextSummary 遮罩後的情境摘要
     * @return 本次嘗試的結果
     */
    TransferStatus initiate(String contextSummary);
}
