package com.treasurylens.indexer;

/**
 * GraphQL documents sent to the indexer. Cursor feeds use {@code after} and read {@code pageInfo}.
 */
final class IndexerQueries {

    private static final String PROJECT_FIELDS = """
            projectId
            chainId
            version
            handle
            owner
            metadataUri
            balance
            volume
            volumeUsd
            paymentsCount
            decimals
            currency
            token
            tokenSymbol
            tokenSupply
            suckerGroupId
            createdAt
            """;

    private static final String SUCKER_GROUP_FIELDS = """
            id
            balance
            volume
            tokenSupply
            paymentsCount
            projects {
              items {
            """ + PROJECT_FIELDS + """
              }
            }
            """;

    private static final String PAGE_INFO = """
            pageInfo {
              hasNextPage
              endCursor
            }
            """;

    static final String PROJECT = """
            query Project($projectId: Float!, $chainId: Float!, $version: Float!) {
              project(projectId: $projectId, chainId: $chainId, version: $version) {
            """ + PROJECT_FIELDS + """
                suckerGroup {
            """ + SUCKER_GROUP_FIELDS + """
                }
              }
            }
            """;

    static final String SUCKER_GROUP = """
            query SuckerGroup($id: String!) {
              suckerGroup(id: $id) {
            """ + SUCKER_GROUP_FIELDS + """
              }
            }
            """;

    static final String PARTICIPANTS_BY_PROJECT = """
            query ProjectParticipants($projectId: Int!, $chainId: Int!, $limit: Int, $after: String) {
              participants(
                where: { projectId: $projectId, chainId: $chainId, balance_gt: "0" }
                limit: $limit
                after: $after
                orderBy: "balance"
                orderDirection: "desc"
              ) {
                totalCount
                items {
                  address
                  chainId
                  balance
                }
            """ + PAGE_INFO + """
              }
            }
            """;

    static final String PARTICIPANTS_BY_GROUP = """
            query GroupParticipants($suckerGroupId: String!, $limit: Int, $after: String) {
              participants(
                where: { suckerGroupId: $suckerGroupId, balance_gt: "0" }
                limit: $limit
                after: $after
                orderBy: "balance"
                orderDirection: "desc"
              ) {
                totalCount
                items {
                  address
                  chainId
                  balance
                }
            """ + PAGE_INFO + """
              }
            }
            """;

    static final String PAY_EVENTS = """
            query PayEvents($projectId: Float!, $chainId: Float!, $version: Float!, $limit: Int, $after: String) {
              payEvents(
                where: { projectId: $projectId, chainId: $chainId, version: $version }
                limit: $limit
                after: $after
                orderBy: "timestamp"
                orderDirection: "desc"
              ) {
                items {
                  amount
                  newlyIssuedTokenCount
                  timestamp
                }
            """ + PAGE_INFO + """
              }
            }
            """;

    static final String CASH_OUT_EVENTS = """
            query CashOutEvents($projectId: Float!, $chainId: Float!, $version: Float!, $limit: Int, $after: String) {
              cashOutTokensEvents(
                where: { projectId: $projectId, chainId: $chainId, version: $version }
                limit: $limit
                after: $after
                orderBy: "timestamp"
                orderDirection: "desc"
              ) {
                items {
                  holder
                  cashOutCount
                  reclaimAmount
                  timestamp
                }
            """ + PAGE_INFO + """
              }
            }
            """;

    static final String ACTIVITY_EVENTS = """
            query ActivityEvents($limit: Int, $after: String) {
              activityEvents(
                limit: $limit
                after: $after
                orderBy: "timestamp"
                orderDirection: "desc"
              ) {
                items {
                  id
                  chainId
                  timestamp
                  from
                  txHash
                  project {
                    name
                    handle
                    decimals
                    currency
                    projectId
                  }
                  payEvent { amount amountUsd }
                  projectCreateEvent { id }
                  cashOutTokensEvent { reclaimAmount }
                  addToBalanceEvent { amount }
                  mintTokensEvent { tokenCount beneficiary }
                  burnEvent { amount }
                  deployErc20Event { symbol }
                  sendPayoutsEvent { amount }
                  sendReservedTokensToSplitsEvent { id }
                  useAllowanceEvent { amount }
                  mintNftEvent { id }
                }
            """ + PAGE_INFO + """
              }
            }
            """;

    private IndexerQueries() {
    }
}
