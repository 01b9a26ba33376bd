/*
 *  Copyright 2022-2025 Carlos Machado
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package pt.cjmach.mmdfexport.pst;

/**
 * Default item type and message class of a folder, derived from its
 * container class. Item type values follow the Outlook {@code OlItemType}
 * enumeration.
 */
enum PstItemType {
    MAIL("IPF.Note", 0, "IPM.Note"),
    APPOINTMENT("IPF.Appointment", 1, "IPM.Appointment"),
    CONTACT("IPF.Contact", 2, "IPM.Contact"),
    TASK("IPF.Task", 3, "IPM.Task"),
    JOURNAL("IPF.Journal", 4, "IPM.Activity"),
    NOTE("IPF.StickyNote", 5, "IPM.StickyNote");

    private final String containerClass;
    private final int itemType;
    private final String messageClass;

    PstItemType(String containerClass, int itemType, String messageClass) {
        this.containerClass = containerClass;
        this.itemType = itemType;
        this.messageClass = messageClass;
    }

    int getItemType() {
        return itemType;
    }

    String getMessageClass() {
        return messageClass;
    }

    /**
     * @param containerClass container class of a folder, e.g.
     * {@code IPF.Note.OutlookHomepage}.
     * @return the matching type; {@link #MAIL} if the container class is empty
     * or unknown.
     */
    static PstItemType fromContainerClass(String containerClass) {
        if (containerClass != null) {
            for (PstItemType type : values()) {
                if (containerClass.equalsIgnoreCase(type.containerClass)
                        || containerClass.regionMatches(true, 0, type.containerClass + ".", 0, type.containerClass.length() + 1)) {
                    return type;
                }
            }
        }
        return MAIL;
    }
}
