/*******************************************************************************
 * DNAMotifs - Search of gapped motifs in genomic sequences
 * Copyright 2026 DNAMotifs developers
 *
 * This file is part of DNAMotifs.
 *
 *     DNAMotifs is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     DNAMotifs is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with DNAMotifs.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package dnamotifs.main;

import java.lang.reflect.Method;

/**
 * Option of a command. The option is mapped to a set method of the program
 * through the attribute name
 */
public class CommandOption {
	public static final String TYPE_INT = "INT";
	public static final String TYPE_LONG = "LONG";
	public static final String TYPE_DOUBLE = "DOUBLE";
	public static final String TYPE_STRING = "STRING";
	public static final String TYPE_FILE = "FILE";
	public static final String TYPE_BOOLEAN = "BOOLEAN";

	private final String id;
	private String type = TYPE_STRING;
	private String defaultValue=null;
	private String description;
	private String attribute;

	public CommandOption(String id) {
		this.id = id;
	}
	public String getId() {
		return id;
	}
	public String getType() {
		return type;
	}
	public void setType(String type) {
		this.type = type;
		//Validates the type
		getTypeClass();
	}
	public String getDefaultValue() {
		return defaultValue;
	}
	public void setDefaultValue(String defaultValue) {
		this.defaultValue = defaultValue;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public String getAttribute() {
		return attribute;
	}
	public void setAttribute(String attribute) {
		this.attribute = attribute;
	}
	public boolean isBoolean() {
		return TYPE_BOOLEAN.equals(type);
	}
	public boolean printType () {
		return !isBoolean();
	}
	public int getPrintLength() {
		int length = id.length()+9;
		if(printType()) length+=type.length()+1;
		return length;
	}
	/**
	 * Finds the method of the given program that receives the value of this option.
	 * Methods receiving the wrapper class of the option type are preferred over methods receiving a String
	 * @param instance Program object
	 * @return Method set method for the attribute of this option
	 */
	public Method findSetMethod (Object instance) {
		if(attribute==null || attribute.length()==0) throw new IllegalStateException("Attribute not set for option: "+id);
		String methodName = "set"+Character.toUpperCase(attribute.charAt(0))+attribute.substring(1);
		try {
			return instance.getClass().getMethod(methodName,getTypeClass());
		} catch (NoSuchMethodException e) {
			try {
				return instance.getClass().getMethod(methodName,String.class);
			} catch (NoSuchMethodException e1) {
				throw new RuntimeException("Program "+instance.getClass().getName()+" does not have a method "+methodName+" for option "+id,e1);
			}
		}
	}
	private Class<?> getTypeClass() {
		if(TYPE_BOOLEAN.equals(type)) return Boolean.class;
		if(TYPE_INT.equals(type)) return Integer.class;
		if(TYPE_LONG.equals(type)) return Long.class;
		if(TYPE_DOUBLE.equals(type)) return Double.class;
		if(TYPE_STRING.equals(type) || TYPE_FILE.equals(type)) return String.class;
		throw new IllegalArgumentException("Unrecognized type "+type+" for option "+id);
	}
	public Object decodeValue (String value) {
		return OptionValuesDecoder.decode(value, getTypeClass());
	}
}
