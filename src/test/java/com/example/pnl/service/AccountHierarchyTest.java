package com.example.pnl.service;

import com.example.pnl.domain.AccountNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AccountHierarchy construction, cycle detection and label resolution.
 */
class AccountHierarchyTest {

    @Test
    void buildChildrenMap_NodesWithParents_GroupsChildrenInEncounterOrder() {
        // Given
        List<AccountNode> nodes = List.of(
            AccountNode.of("Income", null),
            AccountNode.of("Service Revenue", "Income"),
            AccountNode.of("Expense", null),
            AccountNode.of("Rent", "Expense"),
            AccountNode.of("Other Revenue", "Income"));

        // When
        Map<String, List<String>> childrenMap = AccountHierarchy.buildChildrenMap(nodes);

        // Then
        assertEquals(List.of("Income", "Expense"), List.copyOf(childrenMap.keySet()));
        assertEquals(List.of("Service Revenue", "Other Revenue"), childrenMap.get("Income"));
        assertEquals(List.of("Rent"), childrenMap.get("Expense"));
    }

    @Test
    void buildChildrenMap_NodeWithoutLabel_IsSkipped() {
        // Given
        List<AccountNode> nodes = Arrays.asList(
            AccountNode.of("Income", null),
            new AccountNode(null, "Income", 1L, false, false, false),
            null,
            AccountNode.of("Service Revenue", "Income"));

        // When
        Map<String, List<String>> childrenMap = AccountHierarchy.buildChildrenMap(nodes);

        // Then
        assertEquals(List.of("Service Revenue"), childrenMap.get("Income"));
    }

    @Test
    void of_ParentCycle_ThrowsInvalidConfigurationException() {
        // Given
        List<AccountNode> nodes = List.of(
            AccountNode.of("A", "C"),
            AccountNode.of("B", "A"),
            AccountNode.of("C", "B"));

        // When / Then
        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class,
            () -> AccountHierarchy.of(nodes));
        assertEquals(AccountHierarchy.ACCOUNT_CONFIG_DOCUMENT, ex.getDocumentName());
        assertTrue(ex.getMessage().contains("cycle"));
    }

    @Test
    void of_AccountIsItsOwnParent_ThrowsInvalidConfigurationException() {
        List<AccountNode> nodes = List.of(AccountNode.of("Income", "Income"));

        assertThrows(IllegalStateException.class, () -> AccountHierarchy.of(nodes));
    }

    @Test
    void of_ParentNotConfigured_AcceptedAsRoot() {
        // Given - "Missing" is referenced but never configured
        List<AccountNode> nodes = List.of(AccountNode.of("Orphan", "Missing"));

        // When
        AccountHierarchy hierarchy = AccountHierarchy.of(nodes);

        // Then
        assertEquals(1, hierarchy.size());
        assertEquals(List.of("Orphan"), hierarchy.childrenOf("Missing"));
    }

    @Test
    void of_DuplicateLabel_LastEntryWins() {
        // Given
        List<AccountNode> nodes = List.of(
            new AccountNode("Rent", null, 6010L, false, false, false),
            new AccountNode("Rent", null, 6011L, true, false, false));

        // When
        AccountHierarchy hierarchy = AccountHierarchy.of(nodes);

        // Then
        assertEquals(1, hierarchy.size());
        assertTrue(hierarchy.node("Rent").displayExcluded());
        assertEquals(Long.valueOf(6011L), hierarchy.node("Rent").accountInternalId());
    }

    @Test
    void labelFor_MappedAndUnmappedIds_ResolvesOrSynthesizesLabel() {
        // Given
        AccountHierarchy hierarchy = AccountHierarchy.of(List.of(
            new AccountNode("Income", null, 4000L, false, false, false)));

        // Then
        assertEquals("Income", hierarchy.labelFor(4000L));
        assertEquals("Unknown Account 9999", hierarchy.labelFor(9999L));
        assertFalse(hierarchy.isConfigured("Unknown Account 9999"));
    }

    @Test
    void childrenOf_Leaf_ReturnsEmptyList() {
        AccountHierarchy hierarchy = AccountHierarchy.of(List.of(
            AccountNode.of("Income", null),
            AccountNode.of("Service Revenue", "Income")));

        assertTrue(hierarchy.hasChildren("Income"));
        assertFalse(hierarchy.hasChildren("Service Revenue"));
        assertTrue(hierarchy.childrenOf("Service Revenue").isEmpty());
    }
}
