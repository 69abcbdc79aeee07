package dev.shortcuts.target;

import java.util.List;

/**
 * The flat, externally consumed form of a shortcut. Nested control flow is not nested
 * here: conditionals and loops carry a grouping identifier instead.
 */
public record TargetDocument(
    String name,
    WorkflowIcon icon,
    String clientVersion,
    String clientRelease,
    int minimumClientVersion,
    List<String> workflowTypes,
    List<String> inputContentItemClasses,
    List<TargetAction> actions
) {
    public static final String CLIENT_VERSION = "2781";
    public static final String CLIENT_RELEASE = "2.2.2";
    public static final int MINIMUM_CLIENT_VERSION = 900;
    public static final List<String> WORKFLOW_TYPES = List.of("NCWidget", "WatchKit");
    public static final List<String> INPUT_CONTENT_ITEM_CLASSES = List.of(
        "WFAppStoreAppContentItem",
        "WFArticleContentItem",
        "WFContactContentItem",
        "WFDateContentItem",
        "WFEmailAddressContentItem",
        "WFGenericFileContentItem",
        "WFImageContentItem",
        "WFiTunesProductContentItem",
        "WFLocationContentItem",
        "WFDCMapsLinkContentItem",
        "WFAVAssetContentItem",
        "WFPDFContentItem",
        "WFPhoneNumberContentItem",
        "WFRichTextContentItem",
        "WFSafariWebPageContentItem",
        "WFStringContentItem",
        "WFURLContentItem"
    );

    public TargetDocument {
        workflowTypes = List.copyOf(workflowTypes);
        inputContentItemClasses = List.copyOf(inputContentItemClasses);
        actions = List.copyOf(actions);
    }

    /** A document with the fixed client constants. */
    public static TargetDocument of(String name, WorkflowIcon icon, List<TargetAction> actions) {
        return new TargetDocument(name, icon, CLIENT_VERSION, CLIENT_RELEASE, MINIMUM_CLIENT_VERSION,
            WORKFLOW_TYPES, INPUT_CONTENT_ITEM_CLASSES, actions);
    }
}
